package fr.lapetina.preferences.collector;

import fr.lapetina.preferences.collector.infrastructure.config.CollectorConfig;
import fr.lapetina.preferences.collector.infrastructure.config.ConfigLoader;
import fr.lapetina.preferences.collector.infrastructure.http.PreferenceStoreClient;
import fr.lapetina.preferences.collector.infrastructure.http.RemoteClient;
import fr.lapetina.preferences.collector.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.preferences.collector.pipeline.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;

/**
 * Factory for creating a fully-wired collector from configuration.
 * This is the primary entry point for obtaining a configured Collector.
 *
 * <p>Usage:
 * <pre>{@code
 * try (CollectorFactory factory = CollectorFactory.create("collector.yaml")) {
 *     Collector collector = factory.getCollector();
 *     // submit comparisons...
 * }
 * }</pre>
 *
 * Closing the factory stops the collector, which drains its queue one last time.
 */
public class CollectorFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CollectorFactory.class);

    private final CollectorConfig config;
    private final MetricsRegistry metricsRegistry;
    private final RemoteClient client;
    private final PreferenceStoreClient storeClient;
    private final Collector collector;

    protected CollectorFactory(ConfigLoader configLoader, RemoteClient clientOverride) {
        this.config = configLoader.load();

        CollectorConfig.MetricsConfig metricsConfig = config.getMetrics();
        this.metricsRegistry = new MetricsRegistry(metricsConfig.getPrefix(), metricsConfig.isEnabled());

        // Allow override for testing
        if (clientOverride != null) {
            this.storeClient = null;
            this.client = clientOverride;
        } else {
            this.storeClient = createStoreClient();
            this.client = storeClient;
        }

        this.collector = Collector.builder()
                .fromConfig(config)
                .client(client)
                .metricsRegistry(metricsRegistry)
                .build();

        log.info("CollectorFactory initialized: domain={}, store={}",
                collector.getDomain(),
                storeClient != null ? storeClient.getBaseUrl() : "custom client");
    }

    protected CollectorFactory(String configPath, RemoteClient clientOverride) {
        this(new ConfigLoader(configPath), clientOverride);
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static CollectorFactory create(String configPath) {
        log.info("Initializing CollectorFactory from config: {}", configPath);
        return new CollectorFactory(configPath, null);
    }

    /**
     * Creates a factory from the default configuration (collector.yaml).
     */
    public static CollectorFactory create() {
        return create(ConfigLoader.DEFAULT_CONFIG);
    }

    public Collector getCollector() {
        return collector;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public RemoteClient getClient() {
        return client;
    }

    public CollectorConfig getConfig() {
        return config;
    }

    /**
     * Probes the configured store. Always false when a custom client replaced the HTTP one.
     */
    public boolean isStoreHealthy() {
        return storeClient != null && storeClient.healthCheck();
    }

    private PreferenceStoreClient createStoreClient() {
        CollectorConfig.StoreConfig store = config.getStore();
        if (store.getApiKey() == null || store.getApiKey().isBlank()) {
            log.warn("No API key configured for store: baseUrl={}", store.getBaseUrl());
        }
        return new PreferenceStoreClient(
                URI.create(store.getBaseUrl()),
                store.getApiKey(),
                Duration.ofMillis(store.getConnectTimeoutMs()),
                Duration.ofMillis(store.getRequestTimeoutMs()),
                store.getCircuitBreakerFailureThreshold(),
                Duration.ofMillis(store.getCircuitBreakerRecoveryMs())
        );
    }

    @Override
    public void close() {
        log.info("Shutting down CollectorFactory...");

        try {
            collector.close();
        } catch (RuntimeException e) {
            log.warn("Error closing collector", e);
        }

        if (storeClient != null) {
            storeClient.close();
        }

        try {
            metricsRegistry.close();
        } catch (RuntimeException e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("CollectorFactory shut down");
    }
}
