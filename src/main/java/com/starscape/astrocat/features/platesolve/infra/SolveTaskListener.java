package com.starscape.astrocat.features.platesolve.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.astrocat.features.platesolve.app.SolveTaskDispatcher;
import com.starscape.astrocat.features.platesolve.app.SolveTaskMessage;
import io.awspring.cloud.sqs.annotation.SqsListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Consumes solve tasks from SQS. A task that throws is left on the queue for redelivery.
 */
@Component
@ConditionalOnProperty(name = "spring.cloud.aws.sqs.enabled", havingValue = "true")
public class SolveTaskListener {

    private static final Logger log = LoggerFactory.getLogger(SolveTaskListener.class);

    private final SolveTaskDispatcher dispatcher;
    private final ObjectMapper objectMapper;

    public SolveTaskListener(SolveTaskDispatcher dispatcher, ObjectMapper objectMapper) {
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
    }

    @SqsListener("${aws.sqs.solve-queue-url}")
    public void handle(String body) {
        SolveTaskMessage message;
        try {
            message = objectMapper.readValue(body, SolveTaskMessage.class);
        } catch (JsonProcessingException e) {
            log.error("Dropping malformed solve task: {}", body, e);
            return;
        }

        log.debug("Received {} for image {}", message.type(), message.imageId());
        dispatcher.dispatch(message);
    }
}
