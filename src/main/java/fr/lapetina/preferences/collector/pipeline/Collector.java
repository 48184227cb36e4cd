package fr.lapetina.preferences.collector.pipeline;

import fr.lapetina.preferences.collector.domain.model.CollectorStats;
import fr.lapetina.preferences.collector.domain.model.ComparisonSubmission;
import fr.lapetina.preferences.collector.domain.model.ErrorType;
import fr.lapetina.preferences.collector.domain.model.Preference;
import fr.lapetina.preferences.collector.domain.model.QueuedRecord;
import fr.lapetina.preferences.collector.infrastructure.config.CollectorConfig;
import fr.lapetina.preferences.collector.infrastructure.http.RemoteClient;
import fr.lapetina.preferences.collector.infrastructure.http.SendResult;
import fr.lapetina.preferences.collector.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.preferences.collector.pipeline.dedup.DeduplicationCache;
import fr.lapetina.preferences.collector.pipeline.dedup.EvictionPolicy;
import fr.lapetina.preferences.collector.pipeline.quality.QualityGate;
import fr.lapetina.preferences.collector.pipeline.quality.QualityMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for producers: gates, deduplicates, queues and forwards preference comparisons.
 *
 * Submission path (caller's thread):
 * quality gate -> deduplication -> queue -> flush when the queue reaches the batch size.
 *
 * Flushes also run on a background timer. A flush sends queued records one at a
 * time, oldest first; a failed send is counted and the record dropped, never retried.
 * Flushes are serialized, so a producer that crosses the batch size while the
 * timer is flushing waits for it and then drains what is left. A slow store
 * therefore throttles producers once batches fill up.
 *
 * {@link #submit} never throws. Whether an accepted record actually reached the
 * store is only visible through {@link #stats()} and the logs.
 */
public final class Collector implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Collector.class);

    private final String domain;
    private final RemoteClient client;
    private final int batchSize;
    private final boolean qualityGateEnabled;
    private final QualityGate qualityGate;
    private final DeduplicationCache dedupCache;
    private final SubmissionQueue queue = new SubmissionQueue();
    private final MetricsRegistry metrics;
    private final boolean ownsMetrics;
    private final BackgroundFlusher flusher;

    private final ReentrantLock flushLock = new ReentrantLock();
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private final AtomicLong collected = new AtomicLong();
    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong rejectedQuality = new AtomicLong();
    private final AtomicLong rejectedDuplicate = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private Collector(Builder builder) {
        this.domain = builder.domain;
        this.client = builder.client;
        this.batchSize = builder.batchSize;
        this.qualityGateEnabled = builder.qualityGateEnabled;
        this.qualityGate = new QualityGate(builder.thresholds);
        this.dedupCache = new DeduplicationCache(builder.dedupMaxSize, builder.evictionPolicy);
        this.ownsMetrics = builder.metricsRegistry == null;
        this.metrics = ownsMetrics
                ? new MetricsRegistry(MetricsRegistry.DEFAULT_PREFIX, false)
                : builder.metricsRegistry;
        metrics.registerQueueDepth(domain, queue::size);

        if (builder.autoFlush) {
            this.flusher = new BackgroundFlusher(
                    this::flush,
                    builder.flushInterval,
                    builder.shutdownTimeout,
                    "preference-flusher-" + domain
            );
            flusher.start();
        } else {
            this.flusher = null;
        }

        log.info("Collector created: domain={}, batchSize={}, flushInterval={}, qualityGate={}, autoFlush={}, dedupMaxSize={}, eviction={}",
                domain, batchSize, builder.flushInterval, qualityGateEnabled, builder.autoFlush,
                builder.dedupMaxSize, builder.evictionPolicy);
    }

    /**
     * Submits a comparison.
     *
     * @return true if accepted (queued, or already sent by the flush it triggered);
     *         false if rejected by the quality gate or as a duplicate
     */
    public boolean submit(ComparisonSubmission submission) {
        collected.incrementAndGet();

        if (submission == null || qualityGateEnabled) {
            QualityMetrics verdict = qualityGate.validate(submission);
            if (!verdict.isValid()) {
                rejectedQuality.incrementAndGet();
                metrics.recordSubmission(domain, MetricsRegistry.Outcome.REJECTED_QUALITY);
                metrics.recordQualityRejection(domain, verdict.failedCheck());
                log.warn("Submission rejected by quality gate: domain={}, producerId={}, reason={}",
                        domain,
                        submission != null ? submission.producerId() : "null",
                        verdict.rejectionReason());
                return false;
            }
        }

        ComparisonSubmission stamped = submission.withDomain(domain);

        if (dedupCache.isDuplicate(stamped)) {
            rejectedDuplicate.incrementAndGet();
            metrics.recordSubmission(domain, MetricsRegistry.Outcome.REJECTED_DUPLICATE);
            log.info("Submission rejected as duplicate: domain={}, producerId={}, hash={}",
                    domain, stamped.producerId(), DeduplicationCache.hash(stamped));
            return false;
        }

        QueuedRecord record = QueuedRecord.accept(stamped);
        int depth = queue.push(record);
        metrics.recordSubmission(domain, MetricsRegistry.Outcome.ACCEPTED);

        log.debug("Submission accepted: domain={}, category={}, producerId={}, recordId={}, queueDepth={}",
                domain, record.category(), stamped.producerId(), record.recordId(), depth);

        if (depth >= batchSize) {
            log.debug("Batch size reached, flushing: domain={}, queueDepth={}", domain, depth);
            flush();
        }
        return true;
    }

    /**
     * Submits a comparison with default category, session, latencies, confidence and context.
     */
    public boolean submit(
            String prompt,
            String responseA,
            String responseB,
            Preference chosen,
            String producerId
    ) {
        return submit(ComparisonSubmission.of(prompt, responseA, responseB, chosen, producerId));
    }

    public boolean submit(
            String prompt,
            String responseA,
            String responseB,
            Preference chosen,
            String producerId,
            String category,
            String sessionId,
            double latencyA,
            double latencyB,
            double confidence,
            Map<String, Object> context
    ) {
        return submit(ComparisonSubmission.builder()
                .prompt(prompt)
                .responseA(responseA)
                .responseB(responseB)
                .chosen(chosen)
                .producerId(producerId)
                .category(category)
                .sessionId(sessionId)
                .latencyA(latencyA)
                .latencyB(latencyB)
                .confidence(confidence)
                .context(context)
                .build());
    }

    /**
     * Sends every queued record, oldest first, one at a time.
     *
     * @return number of records the store accepted during this call
     */
    public int flush() {
        flushLock.lock();
        try {
            int sent = 0;
            int attempted = 0;
            Optional<QueuedRecord> next;
            while ((next = queue.poll()).isPresent()) {
                attempted++;
                if (send(next.get())) {
                    sent++;
                }
            }
            if (attempted > 0) {
                log.info("Flush complete: domain={}, attempted={}, sent={}, failed={}",
                        domain, attempted, sent, attempted - sent);
            }
            return sent;
        } finally {
            flushLock.unlock();
        }
    }

    private boolean send(QueuedRecord record) {
        Instant startTime = Instant.now();
        SendResult result;
        try {
            result = client.send(record);
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            metrics.recordSend(domain, Duration.between(startTime, Instant.now()), ErrorType.INTERNAL_ERROR);
            log.error("Send threw, record dropped: domain={}, recordId={}", domain, record.recordId(), e);
            return false;
        }
        Duration latency = Duration.between(startTime, Instant.now());

        if (result != null && result.success()) {
            submitted.incrementAndGet();
            metrics.recordSend(domain, latency, null);
            log.debug("Record sent: domain={}, recordId={}, hash={}, latencyMs={}",
                    domain, record.recordId(), result.hash(), latency.toMillis());
            return true;
        }

        ErrorType errorType = result != null ? result.errorType() : ErrorType.INTERNAL_ERROR;
        failed.incrementAndGet();
        metrics.recordSend(domain, latency, errorType);
        log.warn("Send failed, record dropped: domain={}, recordId={}, errorType={}, error={}",
                domain, record.recordId(), errorType, result != null ? result.error() : "no result");
        return false;
    }

    /**
     * Returns a snapshot of the counters and the current queue depth.
     */
    public CollectorStats stats() {
        return new CollectorStats(
                collected.get(),
                submitted.get(),
                rejectedQuality.get(),
                rejectedDuplicate.get(),
                failed.get(),
                queue.size()
        );
    }

    /**
     * Stops the background flusher and drains the queue once.
     * Only the first call has an effect.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("Stopping collector: domain={}, queueDepth={}", domain, queue.size());

        if (flusher != null) {
            flusher.close();
        }

        int sent = flush();
        CollectorStats stats = stats();
        log.info("Collector stopped: domain={}, finalFlushSent={}, collected={}, submitted={}, rejectedQuality={}, rejectedDuplicate={}, failed={}",
                domain, sent, stats.collected(), stats.submitted(), stats.rejectedQuality(),
                stats.rejectedDuplicate(), stats.failed());

        if (ownsMetrics) {
            metrics.close();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isStopped() {
        return stopped.get();
    }

    public String getDomain() {
        return domain;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public boolean isQualityGateEnabled() {
        return qualityGateEnabled;
    }

    public boolean isAutoFlushRunning() {
        return flusher != null && flusher.isRunning();
    }

    // Getters for testing
    QualityGate getQualityGate() {
        return qualityGate;
    }

    DeduplicationCache getDedupCache() {
        return dedupCache;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Collector.
     */
    public static final class Builder {
        private String domain;
        private RemoteClient client;
        private int batchSize = 10;
        private Duration flushInterval = Duration.ofSeconds(60);
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        private boolean qualityGateEnabled = true;
        private boolean autoFlush = true;
        private QualityGate.Thresholds thresholds = QualityGate.Thresholds.defaults();
        private int dedupMaxSize = DeduplicationCache.DEFAULT_MAX_SIZE;
        private EvictionPolicy evictionPolicy = EvictionPolicy.LRU;
        private MetricsRegistry metricsRegistry;

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder client(RemoteClient client) {
            this.client = client;
            return this;
        }

        public Builder batchSize(int batchSize) {
            if (batchSize < 1) {
                throw new IllegalArgumentException("Batch size must be at least 1");
            }
            this.batchSize = batchSize;
            return this;
        }

        public Builder flushInterval(Duration flushInterval) {
            this.flushInterval = flushInterval;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public Builder qualityGateEnabled(boolean enabled) {
            this.qualityGateEnabled = enabled;
            return this;
        }

        public Builder autoFlush(boolean autoFlush) {
            this.autoFlush = autoFlush;
            return this;
        }

        public Builder thresholds(QualityGate.Thresholds thresholds) {
            this.thresholds = thresholds;
            return this;
        }

        public Builder dedupMaxSize(int maxSize) {
            this.dedupMaxSize = maxSize;
            return this;
        }

        public Builder evictionPolicy(EvictionPolicy policy) {
            this.evictionPolicy = policy;
            return this;
        }

        /**
         * Shares a registry with other components. Without one the collector
         * creates a private registry and closes it on stop.
         */
        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder fromConfig(CollectorConfig config) {
            CollectorConfig.CollectorSection collector = config.getCollector();
            CollectorConfig.QualityGateConfig gate = config.getQualityGate();
            CollectorConfig.DeduplicationConfig dedup = config.getDeduplication();

            this.domain = collector.getDomain();
            batchSize(collector.getBatchSize());
            this.flushInterval = Duration.ofSeconds(collector.getFlushIntervalSeconds());
            this.shutdownTimeout = Duration.ofSeconds(collector.getShutdownTimeoutSeconds());
            this.qualityGateEnabled = collector.isQualityGateEnabled();
            this.autoFlush = collector.isAutoFlush();
            this.thresholds = new QualityGate.Thresholds(
                    gate.getMinPromptLength(),
                    gate.getMinResponseLength(),
                    gate.getMaxResponseLength(),
                    gate.getMinLengthRatio(),
                    gate.getEchoRatio()
            );
            this.dedupMaxSize = dedup.getMaxSize();
            this.evictionPolicy = EvictionPolicy.fromName(dedup.getEviction())
                    .orElseGet(() -> {
                        log.warn("Unknown eviction policy '{}', using LRU", dedup.getEviction());
                        return EvictionPolicy.LRU;
                    });
            return this;
        }

        public Collector build() {
            if (domain == null || domain.isBlank()) {
                throw new IllegalStateException("Domain is required");
            }
            if (client == null) {
                throw new IllegalStateException("RemoteClient is required");
            }
            return new Collector(this);
        }
    }
}
