package fr.lapetina.preferences.collector.infrastructure.config;

/**
 * Root configuration object for a preference collector.
 * Designed to be populated from YAML.
 */
public class CollectorConfig {

    private CollectorSection collector = new CollectorSection();
    private QualityGateConfig qualityGate = new QualityGateConfig();
    private DeduplicationConfig deduplication = new DeduplicationConfig();
    private StoreConfig store = new StoreConfig();
    private MetricsConfig metrics = new MetricsConfig();

    public CollectorSection getCollector() { return collector; }
    public void setCollector(CollectorSection collector) { this.collector = collector; }

    public QualityGateConfig getQualityGate() { return qualityGate; }
    public void setQualityGate(QualityGateConfig qualityGate) { this.qualityGate = qualityGate; }

    public DeduplicationConfig getDeduplication() { return deduplication; }
    public void setDeduplication(DeduplicationConfig deduplication) { this.deduplication = deduplication; }

    public StoreConfig getStore() { return store; }
    public void setStore(StoreConfig store) { this.store = store; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Batching, flushing and lifecycle.
     */
    public static class CollectorSection {
        private String domain = "general";
        private int batchSize = 10;
        private long flushIntervalSeconds = 60;
        private boolean qualityGateEnabled = true;
        private boolean autoFlush = true;
        private long shutdownTimeoutSeconds = 30;

        public String getDomain() { return domain; }
        public void setDomain(String domain) { this.domain = domain; }

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

        public long getFlushIntervalSeconds() { return flushIntervalSeconds; }
        public void setFlushIntervalSeconds(long flushIntervalSeconds) { this.flushIntervalSeconds = flushIntervalSeconds; }

        public boolean isQualityGateEnabled() { return qualityGateEnabled; }
        public void setQualityGateEnabled(boolean qualityGateEnabled) { this.qualityGateEnabled = qualityGateEnabled; }

        public boolean isAutoFlush() { return autoFlush; }
        public void setAutoFlush(boolean autoFlush) { this.autoFlush = autoFlush; }

        public long getShutdownTimeoutSeconds() { return shutdownTimeoutSeconds; }
        public void setShutdownTimeoutSeconds(long shutdownTimeoutSeconds) { this.shutdownTimeoutSeconds = shutdownTimeoutSeconds; }
    }

    /**
     * Quality gate thresholds.
     */
    public static class QualityGateConfig {
        private int minPromptLength = 10;
        private int minResponseLength = 50;
        private int maxResponseLength = 10000;
        private double minLengthRatio = 0.3;
        private double echoRatio = 1.5;

        public int getMinPromptLength() { return minPromptLength; }
        public void setMinPromptLength(int minPromptLength) { this.minPromptLength = minPromptLength; }

        public int getMinResponseLength() { return minResponseLength; }
        public void setMinResponseLength(int minResponseLength) { this.minResponseLength = minResponseLength; }

        public int getMaxResponseLength() { return maxResponseLength; }
        public void setMaxResponseLength(int maxResponseLength) { this.maxResponseLength = maxResponseLength; }

        public double getMinLengthRatio() { return minLengthRatio; }
        public void setMinLengthRatio(double minLengthRatio) { this.minLengthRatio = minLengthRatio; }

        public double getEchoRatio() { return echoRatio; }
        public void setEchoRatio(double echoRatio) { this.echoRatio = echoRatio; }
    }

    /**
     * Deduplication cache sizing.
     */
    public static class DeduplicationConfig {
        private int maxSize = 10000;
        private String eviction = "lru";

        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }

        public String getEviction() { return eviction; }
        public void setEviction(String eviction) { this.eviction = eviction; }
    }

    /**
     * Remote preference store connection.
     */
    public static class StoreConfig {
        private String baseUrl = "http://localhost:7860";
        private String apiKey;
        private long connectTimeoutMs = 10000;
        private long requestTimeoutMs = 10000;
        private int circuitBreakerFailureThreshold = 5;
        private long circuitBreakerRecoveryMs = 30000;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public int getCircuitBreakerFailureThreshold() { return circuitBreakerFailureThreshold; }
        public void setCircuitBreakerFailureThreshold(int threshold) { this.circuitBreakerFailureThreshold = threshold; }

        public long getCircuitBreakerRecoveryMs() { return circuitBreakerRecoveryMs; }
        public void setCircuitBreakerRecoveryMs(long ms) { this.circuitBreakerRecoveryMs = ms; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "preference_collector";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
