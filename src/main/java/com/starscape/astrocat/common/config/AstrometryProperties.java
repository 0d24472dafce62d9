package com.starscape.astrocat.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the plate-solve workflow.
 * Binds to app.astrometry.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.astrometry")
public class AstrometryProperties {

    private Endpoint nova = new Endpoint();
    private Endpoint local = new Endpoint();
    private long lockTimeoutMs = 10_000;
    private int throttleRetrySeconds = 20;
    private int lockRetrySeconds = 5;
    private int pollIntervalSeconds = 15;
    private int maxPollAttempts = 45;
    private int staleAfterMinutes = 5;
    private int uploadMaxDimension = 2000;
    private int submitMaxRetries = 20;
    private int submitRetryBaseSeconds = 15;
    private int workerThreads = 4;
    private int httpTimeoutSeconds = 60;
    private String annotatedPrefix = "annotated";

    public Endpoint getNova() {
        return nova;
    }

    public void setNova(Endpoint nova) {
        this.nova = nova;
    }

    public Endpoint getLocal() {
        return local;
    }

    public void setLocal(Endpoint local) {
        this.local = local;
    }

    public long getLockTimeoutMs() {
        return lockTimeoutMs;
    }

    public void setLockTimeoutMs(long lockTimeoutMs) {
        this.lockTimeoutMs = lockTimeoutMs;
    }

    public int getThrottleRetrySeconds() {
        return throttleRetrySeconds;
    }

    public void setThrottleRetrySeconds(int throttleRetrySeconds) {
        this.throttleRetrySeconds = throttleRetrySeconds;
    }

    public int getLockRetrySeconds() {
        return lockRetrySeconds;
    }

    public void setLockRetrySeconds(int lockRetrySeconds) {
        this.lockRetrySeconds = lockRetrySeconds;
    }

    public int getPollIntervalSeconds() {
        return pollIntervalSeconds;
    }

    public void setPollIntervalSeconds(int pollIntervalSeconds) {
        this.pollIntervalSeconds = pollIntervalSeconds;
    }

    public int getMaxPollAttempts() {
        return maxPollAttempts;
    }

    public void setMaxPollAttempts(int maxPollAttempts) {
        this.maxPollAttempts = maxPollAttempts;
    }

    public int getStaleAfterMinutes() {
        return staleAfterMinutes;
    }

    public void setStaleAfterMinutes(int staleAfterMinutes) {
        this.staleAfterMinutes = staleAfterMinutes;
    }

    public int getUploadMaxDimension() {
        return uploadMaxDimension;
    }

    public void setUploadMaxDimension(int uploadMaxDimension) {
        this.uploadMaxDimension = uploadMaxDimension;
    }

    public int getSubmitMaxRetries() {
        return submitMaxRetries;
    }

    public void setSubmitMaxRetries(int submitMaxRetries) {
        this.submitMaxRetries = submitMaxRetries;
    }

    public int getSubmitRetryBaseSeconds() {
        return submitRetryBaseSeconds;
    }

    public void setSubmitRetryBaseSeconds(int submitRetryBaseSeconds) {
        this.submitRetryBaseSeconds = submitRetryBaseSeconds;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public int getHttpTimeoutSeconds() {
        return httpTimeoutSeconds;
    }

    public void setHttpTimeoutSeconds(int httpTimeoutSeconds) {
        this.httpTimeoutSeconds = httpTimeoutSeconds;
    }

    public String getAnnotatedPrefix() {
        return annotatedPrefix;
    }

    public void setAnnotatedPrefix(String annotatedPrefix) {
        this.annotatedPrefix = annotatedPrefix;
    }

    /**
     * A solver API endpoint and the key used to log into it.
     */
    public static class Endpoint {

        private String url;
        private String apiKey;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public boolean isConfigured() {
            return url != null && !url.isBlank() && apiKey != null && !apiKey.isBlank();
        }
    }
}
