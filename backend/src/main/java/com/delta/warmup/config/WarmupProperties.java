package com.delta.warmup.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "warmup")
public class WarmupProperties {
    private static final String DEFAULT_USER_AGENT = "delta-warmup/0.1 (+placement-tests)";

    private RateLimit rateLimit = new RateLimit();
    private Retry retry = new Retry();
    private Policy policy = new Policy();
    private Http http = new Http();
    private Providers providers = new Providers();
    private Daemon daemon = new Daemon();
    private Persistence persistence = new Persistence();

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Policy getPolicy() {
        return policy;
    }

    public void setPolicy(Policy policy) {
        this.policy = policy;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Providers getProviders() {
        return providers;
    }

    public void setProviders(Providers providers) {
        this.providers = providers;
    }

    public Daemon getDaemon() {
        return daemon;
    }

    public void setDaemon(Daemon daemon) {
        this.daemon = daemon;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public void setPersistence(Persistence persistence) {
        this.persistence = persistence;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class RateLimit {
        private int maxRequestsPerInterval = 60;
        private long intervalMs = 1000;
        private long maxWaitMs = 30_000;

        public int getMaxRequestsPerInterval() {
            return Math.max(1, maxRequestsPerInterval);
        }

        public void setMaxRequestsPerInterval(int maxRequestsPerInterval) {
            this.maxRequestsPerInterval = Math.max(1, maxRequestsPerInterval);
        }

        public long getIntervalMs() {
            return Math.max(1, intervalMs);
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = Math.max(1, intervalMs);
        }

        public long getMaxWaitMs() {
            return Math.max(0, maxWaitMs);
        }

        public void setMaxWaitMs(long maxWaitMs) {
            this.maxWaitMs = Math.max(0, maxWaitMs);
        }
    }

    public static class Retry {
        private int maxRetries = 3;
        private long initialBackoffMs = 1000;
        private double backoffMultiplier = 1.5;
        private long maxBackoffMs = 30_000;

        /**
         * Total attempts, the first call included.
         */
        public int getMaxRetries() {
            return Math.max(1, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(1, maxRetries);
        }

        public long getInitialBackoffMs() {
            return Math.max(0, initialBackoffMs);
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = Math.max(0, initialBackoffMs);
        }

        public double getBackoffMultiplier() {
            return Math.max(1.0, backoffMultiplier);
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = Math.max(1.0, backoffMultiplier);
        }

        public long getMaxBackoffMs() {
            return Math.max(getInitialBackoffMs(), maxBackoffMs);
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = Math.max(0, maxBackoffMs);
        }
    }

    public static class Policy {
        private int minHoursBetweenTests = 24;
        private int monthlyTestQuota = 100;
        private int warmingCadenceHours = 24;
        private int activeCadenceHours = 72;
        private int warmingVolumePercent = 25;
        private int rotationScoreThreshold = 70;
        private int lowScoreStreak = 2;
        private int highScoreThreshold = 90;
        private int highScoreStreak = 3;
        private int volumeIncreasePercent = 25;
        private int graduationAverageScore = 75;
        private int graduationWindow = 3;
        private int historyLimit = 10;

        public int getMinHoursBetweenTests() {
            return Math.max(0, minHoursBetweenTests);
        }

        public void setMinHoursBetweenTests(int minHoursBetweenTests) {
            this.minHoursBetweenTests = Math.max(0, minHoursBetweenTests);
        }

        public int getMonthlyTestQuota() {
            return Math.max(0, monthlyTestQuota);
        }

        public void setMonthlyTestQuota(int monthlyTestQuota) {
            this.monthlyTestQuota = Math.max(0, monthlyTestQuota);
        }

        public int getWarmingCadenceHours() {
            return Math.max(1, warmingCadenceHours);
        }

        public void setWarmingCadenceHours(int warmingCadenceHours) {
            this.warmingCadenceHours = Math.max(1, warmingCadenceHours);
        }

        public int getActiveCadenceHours() {
            return Math.max(1, activeCadenceHours);
        }

        public void setActiveCadenceHours(int activeCadenceHours) {
            this.activeCadenceHours = Math.max(1, activeCadenceHours);
        }

        public int getWarmingVolumePercent() {
            return clampPercent(warmingVolumePercent);
        }

        public void setWarmingVolumePercent(int warmingVolumePercent) {
            this.warmingVolumePercent = clampPercent(warmingVolumePercent);
        }

        public int getRotationScoreThreshold() {
            return clampPercent(rotationScoreThreshold);
        }

        public void setRotationScoreThreshold(int rotationScoreThreshold) {
            this.rotationScoreThreshold = clampPercent(rotationScoreThreshold);
        }

        public int getLowScoreStreak() {
            return Math.max(1, lowScoreStreak);
        }

        public void setLowScoreStreak(int lowScoreStreak) {
            this.lowScoreStreak = Math.max(1, lowScoreStreak);
        }

        public int getHighScoreThreshold() {
            return clampPercent(highScoreThreshold);
        }

        public void setHighScoreThreshold(int highScoreThreshold) {
            this.highScoreThreshold = clampPercent(highScoreThreshold);
        }

        public int getHighScoreStreak() {
            return Math.max(1, highScoreStreak);
        }

        public void setHighScoreStreak(int highScoreStreak) {
            this.highScoreStreak = Math.max(1, highScoreStreak);
        }

        public int getVolumeIncreasePercent() {
            return Math.max(0, volumeIncreasePercent);
        }

        public void setVolumeIncreasePercent(int volumeIncreasePercent) {
            this.volumeIncreasePercent = Math.max(0, volumeIncreasePercent);
        }

        public int getGraduationAverageScore() {
            return clampPercent(graduationAverageScore);
        }

        public void setGraduationAverageScore(int graduationAverageScore) {
            this.graduationAverageScore = clampPercent(graduationAverageScore);
        }

        public int getGraduationWindow() {
            return Math.max(1, graduationWindow);
        }

        public void setGraduationWindow(int graduationWindow) {
            this.graduationWindow = Math.max(1, graduationWindow);
        }

        public int getHistoryLimit() {
            return Math.max(getMinimumHistory(), historyLimit);
        }

        public void setHistoryLimit(int historyLimit) {
            this.historyLimit = Math.max(1, historyLimit);
        }

        private int getMinimumHistory() {
            return Math.max(getGraduationWindow(), Math.max(getLowScoreStreak(), getHighScoreStreak()));
        }

        private static int clampPercent(int value) {
            return Math.max(0, Math.min(100, value));
        }
    }

    public static class Http {
        private String userAgent;
        private int requestTimeoutSeconds = 20;
        private int maxConcurrentRequests = 4;

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getMaxConcurrentRequests() {
            return Math.max(1, maxConcurrentRequests);
        }

        public void setMaxConcurrentRequests(int maxConcurrentRequests) {
            this.maxConcurrentRequests = Math.max(1, maxConcurrentRequests);
        }
    }

    public static class Providers {
        private EmailGuard emailguard = new EmailGuard();
        private Smartlead smartlead = new Smartlead();

        public EmailGuard getEmailguard() {
            return emailguard;
        }

        public void setEmailguard(EmailGuard emailguard) {
            this.emailguard = emailguard;
        }

        public Smartlead getSmartlead() {
            return smartlead;
        }

        public void setSmartlead(Smartlead smartlead) {
            this.smartlead = smartlead;
        }
    }

    public static class EmailGuard {
        private boolean enabled = true;
        private String apiKey;
        private String baseUrl = "https://app.emailguard.io";
        private int maxRequestsPerInterval = 60;
        private long intervalMs = 60_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey == null ? null : apiKey.trim();
        }

        public String getBaseUrl() {
            if (baseUrl == null || baseUrl.isBlank()) {
                return "https://app.emailguard.io";
            }
            String trimmed = baseUrl.trim();
            return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getMaxRequestsPerInterval() {
            return Math.max(1, maxRequestsPerInterval);
        }

        public void setMaxRequestsPerInterval(int maxRequestsPerInterval) {
            this.maxRequestsPerInterval = Math.max(1, maxRequestsPerInterval);
        }

        public long getIntervalMs() {
            return Math.max(1, intervalMs);
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = Math.max(1, intervalMs);
        }
    }

    public static class Smartlead {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Daemon {
        private boolean enabled = false;
        private int pollIntervalMs = 30_000;
        private int batchSize = 25;
        private boolean autoApplySignals = false;
        private String defaultProvider = "emailguard";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPollIntervalMs() {
            return Math.max(100, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = Math.max(100, pollIntervalMs);
        }

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public boolean isAutoApplySignals() {
            return autoApplySignals;
        }

        public void setAutoApplySignals(boolean autoApplySignals) {
            this.autoApplySignals = autoApplySignals;
        }

        public String getDefaultProvider() {
            return defaultProvider == null || defaultProvider.isBlank() ? "emailguard" : defaultProvider.trim();
        }

        public void setDefaultProvider(String defaultProvider) {
            this.defaultProvider = defaultProvider;
        }
    }

    public static class Persistence {
        private String mode = "jdbc";

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }
    }
}
