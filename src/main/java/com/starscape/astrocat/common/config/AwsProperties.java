package com.starscape.astrocat.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.time.Duration;

/**
 * AWS settings: the preview bucket, the solve-task queue and optional overrides for
 * S3/SQS-compatible endpoints such as LocalStack or MinIO.
 * Binds to aws.* properties from application.yml
 */
@ConfigurationProperties(prefix = "aws")
public class AwsProperties {

    private String region = "us-east-1";
    private String profile;
    private String endpoint;
    private String accessKey;
    private String secretKey;
    private S3 s3 = new S3();
    private Sqs sqs = new Sqs();

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getProfile() {
        return profile;
    }

    public void setProfile(String profile) {
        this.profile = profile;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public boolean hasEndpointOverride() {
        return endpoint != null && !endpoint.isBlank();
    }

    public URI endpointUri() {
        return URI.create(endpoint.trim());
    }

    public String getAccessKey() {
        return accessKey;
    }

    public void setAccessKey(String accessKey) {
        this.accessKey = accessKey;
    }

    public String getSecretKey() {
        return secretKey;
    }

    public void setSecretKey(String secretKey) {
        this.secretKey = secretKey;
    }

    public S3 getS3() {
        return s3;
    }

    public void setS3(S3 s3) {
        this.s3 = s3;
    }

    public Sqs getSqs() {
        return sqs;
    }

    public void setSqs(Sqs sqs) {
        this.sqs = sqs;
    }

    public boolean hasStaticCredentials() {
        return accessKey != null && !accessKey.isBlank() && secretKey != null && !secretKey.isBlank();
    }

    public static class S3 {

        private String bucket = "astrocat-annotations";
        private Duration presignDuration = Duration.ofMinutes(5);

        public String getBucket() {
            return bucket;
        }

        public void setBucket(String bucket) {
            this.bucket = bucket;
        }

        public Duration getPresignDuration() {
            return presignDuration;
        }

        public void setPresignDuration(Duration presignDuration) {
            this.presignDuration = presignDuration;
        }
    }

    public static class Sqs {

        private String solveQueueUrl;

        public String getSolveQueueUrl() {
            return solveQueueUrl;
        }

        public void setSolveQueueUrl(String solveQueueUrl) {
            this.solveQueueUrl = solveQueueUrl;
        }
    }
}
