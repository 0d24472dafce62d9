package com.starscape.astrocat.features.platesolve.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.astrocat.common.config.AwsProperties;
import com.starscape.astrocat.features.platesolve.app.SolveTaskMessage;
import com.starscape.astrocat.features.platesolve.app.SolveTaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;

import java.time.Duration;

/**
 * Durable solve queue on SQS. SQS caps message delay at 15 minutes.
 */
@Component
@ConditionalOnProperty(name = "spring.cloud.aws.sqs.enabled", havingValue = "true")
public class SqsSolveTaskQueue implements SolveTaskQueue {

    static final int MAX_DELAY_SECONDS = 900;

    private static final Logger log = LoggerFactory.getLogger(SqsSolveTaskQueue.class);

    private final SqsClient sqsClient;
    private final ObjectMapper objectMapper;
    private final String queueUrl;

    public SqsSolveTaskQueue(
            SqsClient sqsClient,
            ObjectMapper objectMapper,
            AwsProperties awsProperties) {
        String queueUrl = awsProperties.getSqs().getSolveQueueUrl();
        if (queueUrl == null || queueUrl.isBlank()) {
            throw new IllegalStateException("aws.sqs.solve-queue-url must be set when the SQS solve queue is enabled");
        }
        this.sqsClient = sqsClient;
        this.objectMapper = objectMapper;
        this.queueUrl = queueUrl;
    }

    @Override
    public void enqueue(SolveTaskMessage message, Duration delay) {
        long seconds = delay == null ? 0 : Math.max(0, delay.toSeconds());
        int delaySeconds = (int) Math.min(seconds, MAX_DELAY_SECONDS);

        String body;
        try {
            body = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize solve task", e);
        }

        sqsClient.sendMessage(SendMessageRequest.builder()
                .queueUrl(queueUrl)
                .messageBody(body)
                .delaySeconds(delaySeconds)
                .build());
        log.debug("Sent {} for image {} to SQS (delay {}s)", message.type(), message.imageId(), delaySeconds);
    }
}
