package fr.lapetina.preferences.collector.infrastructure.metrics;

import fr.lapetina.preferences.collector.domain.model.ErrorType;
import fr.lapetina.preferences.collector.pipeline.quality.QualityCheck;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Submission outcome counters (accepted, rejected by quality, rejected as duplicate)
 * - Quality rejection counters per failed check
 * - Send result counters and failure counters per error type
 * - Send latency timer
 * - Queue depth gauges per domain
 * - JVM and system metrics
 * - Prometheus exposition
 *
 * The collector's own stats snapshot stays authoritative; these meters mirror it.
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    public static final String DEFAULT_PREFIX = "preference_collector";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> outcomeCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> rejectionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> sendCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> failureCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();

    /**
     * @param bindJvmMetrics whether to register the JVM and processor binders
     */
    public MetricsRegistry(String prefix, boolean bindJvmMetrics) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        if (bindJvmMetrics) {
            new JvmMemoryMetrics().bindTo(registry);
            new JvmGcMetrics().bindTo(registry);
            new JvmThreadMetrics().bindTo(registry);
            new ProcessorMetrics().bindTo(registry);
        }

        log.info("MetricsRegistry initialized: prefix={}, jvmMetrics={}", prefix, bindJvmMetrics);
    }

    public MetricsRegistry(String prefix) {
        this(prefix, true);
    }

    public MetricsRegistry() {
        this(DEFAULT_PREFIX);
    }

    /**
     * Counts a submit() verdict: accepted, rejected_quality or rejected_duplicate.
     */
    public void recordSubmission(String domain, Outcome outcome) {
        String key = domain + ":" + outcome.tag();
        outcomeCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_submissions_total")
                        .description("Submissions by verdict")
                        .tag("domain", domain)
                        .tag("outcome", outcome.tag())
                        .register(registry)
        ).increment();
    }

    /**
     * Counts a quality rejection under the check that failed.
     */
    public void recordQualityRejection(String domain, QualityCheck check) {
        String key = domain + ":" + check.name();
        rejectionCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_quality_rejections_total")
                        .description("Quality gate rejections by failed check")
                        .tag("domain", domain)
                        .tag("check", check.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records one send attempt with its latency.
     *
     * @param errorType null for a successful send
     */
    public void recordSend(String domain, Duration latency, ErrorType errorType) {
        String result = errorType == null ? "success" : "failure";
        sendCounters.computeIfAbsent(domain + ":" + result, k ->
                Counter.builder(prefix + "_sends_total")
                        .description("Record sends to the preference store")
                        .tag("domain", domain)
                        .tag("result", result)
                        .register(registry)
        ).increment();

        latencyTimers.computeIfAbsent(domain, k ->
                Timer.builder(prefix + "_send_latency")
                        .description("Latency of a single record send")
                        .tag("domain", domain)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);

        if (errorType != null) {
            failureCounters.computeIfAbsent(domain + ":" + errorType.name(), k ->
                    Counter.builder(prefix + "_send_failures_total")
                            .description("Failed sends by error type")
                            .tag("domain", domain)
                            .tag("type", errorType.name())
                            .register(registry)
            ).increment();
        }
    }

    /**
     * Registers a gauge reporting the queue depth of a collector.
     */
    public void registerQueueDepth(String domain, Supplier<Number> depth) {
        Gauge.builder(prefix + "_queue_depth", depth, s -> s.get().doubleValue())
                .description("Records waiting for transmission")
                .tag("domain", domain)
                .strongReference(true)
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public void close() {
        registry.close();
    }

    /**
     * Synchronous verdict of a submission.
     */
    public enum Outcome {
        ACCEPTED("accepted"),
        REJECTED_QUALITY("rejected_quality"),
        REJECTED_DUPLICATE("rejected_duplicate");

        private final String tag;

        Outcome(String tag) {
            this.tag = tag;
        }

        public String tag() {
            return tag;
        }
    }
}
