package fr.lapetina.preferences.collector.pipeline;

import fr.lapetina.preferences.collector.domain.model.CollectorStats;
import fr.lapetina.preferences.collector.domain.model.ComparisonSubmission;
import fr.lapetina.preferences.collector.domain.model.ErrorType;
import fr.lapetina.preferences.collector.domain.model.Preference;
import fr.lapetina.preferences.collector.domain.model.QueuedRecord;
import fr.lapetina.preferences.collector.infrastructure.config.CollectorConfig;
import fr.lapetina.preferences.collector.infrastructure.config.ConfigLoader;
import fr.lapetina.preferences.collector.infrastructure.http.SendResult;
import fr.lapetina.preferences.collector.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.preferences.collector.pipeline.dedup.EvictionPolicy;
import fr.lapetina.preferences.collector.pipeline.quality.QualityGate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CollectorTest {

    private static final String FILLER = " This answer is padded with enough explanation to pass the length checks.";

    private final List<Collector> collectors = new ArrayList<>();

    @AfterEach
    void tearDown() {
        collectors.forEach(Collector::stop);
    }

    private Collector collector(RecordingClient client, int batchSize) {
        Collector collector = Collector.builder()
                .domain("test_domain")
                .client(client)
                .batchSize(batchSize)
                .autoFlush(false)
                .build();
        collectors.add(collector);
        return collector;
    }

    private static ComparisonSubmission submission(int n) {
        return ComparisonSubmission.of(
                "Question number " + n + " about geography?",
                "Answer A to question " + n + "." + FILLER,
                "Answer B to question " + n + "." + FILLER + " It adds a little more.",
                Preference.A,
                "user_" + (n % 5)
        );
    }

    @Nested
    @DisplayName("submission")
    class Submission {

        @Test
        @DisplayName("should accept and queue a valid comparison")
        void shouldQueueValidComparison() {
            RecordingClient client = new RecordingClient();
            Collector collector = collector(client, 10);

            assertThat(collector.submit(submission(1))).isTrue();

            CollectorStats stats = collector.stats();
            assertThat(stats.collected()).isEqualTo(1);
            assertThat(stats.queueDepth()).isEqualTo(1);
            assertThat(client.count()).isZero();
        }

        @Test
        @DisplayName("should reject low quality comparisons and count them")
        void shouldRejectLowQuality() {
            Collector collector = collector(new RecordingClient(), 10);

            boolean accepted = collector.submit(ComparisonSubmission.of(
                    "Hi", "Hello there", "Hey", Preference.A, "user_1"));

            assertThat(accepted).isFalse();
            assertThat(collector.stats().rejectedQuality()).isEqualTo(1);
            assertThat(collector.stats().queueDepth()).isZero();
        }

        @Test
        @DisplayName("should reject a repeated comparison as duplicate")
        void shouldRejectDuplicate() {
            Collector collector = collector(new RecordingClient(), 10);

            assertThat(collector.submit(submission(1))).isTrue();
            assertThat(collector.submit(submission(1))).isFalse();

            assertThat(collector.stats().rejectedDuplicate()).isEqualTo(1);
            assertThat(collector.stats().queueDepth()).isEqualTo(1);
        }

        @Test
        @DisplayName("should not throw for a null submission")
        void shouldRejectNullSubmission() {
            Collector collector = collector(new RecordingClient(), 10);

            assertThat(collector.submit((ComparisonSubmission) null)).isFalse();
            assertThat(collector.stats().rejectedQuality()).isEqualTo(1);
        }

        @Test
        @DisplayName("should reject a null submission even with the gate disabled")
        void shouldRejectNullWithGateDisabled() {
            Collector collector = Collector.builder()
                    .domain("test_domain")
                    .client(new RecordingClient())
                    .qualityGateEnabled(false)
                    .autoFlush(false)
                    .build();
            collectors.add(collector);

            assertThat(collector.submit((ComparisonSubmission) null)).isFalse();
            assertThat(collector.stats().rejectedQuality()).isEqualTo(1);
        }

        @Test
        @DisplayName("should skip quality checks when the gate is disabled")
        void shouldSkipGateWhenDisabled() {
            Collector collector = Collector.builder()
                    .domain("test_domain")
                    .client(new RecordingClient())
                    .qualityGateEnabled(false)
                    .autoFlush(false)
                    .build();
            collectors.add(collector);

            assertThat(collector.submit("Hi", "Hello", "Hey", Preference.TIE, "user_1")).isTrue();
            // Deduplication still applies
            assertThat(collector.submit("Hi", "Hello", "Hey", Preference.TIE, "user_2")).isFalse();
        }

        @Test
        @DisplayName("should stamp the collector domain on every record")
        void shouldStampDomain() {
            RecordingClient client = new RecordingClient();
            Collector collector = collector(client, 1);

            collector.submit(ComparisonSubmission.builder()
                    .prompt("Question number 1 about geography?")
                    .responseA("Answer A." + FILLER)
                    .responseB("Answer B." + FILLER)
                    .chosen(Preference.B)
                    .producerId("user_1")
                    .domain("somewhere_else")
                    .category("Capital Cities")
                    .build());

            QueuedRecord record = client.getReceived().get(0);
            assertThat(record.domain()).isEqualTo("test_domain");
            assertThat(record.submission().domain()).isEqualTo("test_domain");
            assertThat(record.category()).isEqualTo("capital_cities");
        }

        @Test
        @DisplayName("should pass every field of the full overload")
        void shouldPassFullOverload() {
            RecordingClient client = new RecordingClient();
            Collector collector = collector(client, 1);

            collector.submit(
                    "Question number 1 about geography?",
                    "Answer A." + FILLER,
                    "Answer B." + FILLER,
                    Preference.B,
                    "user_9",
                    "geo",
                    "session-7",
                    1.5,
                    2.5,
                    0.8,
                    Map.of("page", "results")
            );

            ComparisonSubmission sent = client.getReceived().get(0).submission();
            assertThat(sent.producerId()).isEqualTo("user_9");
            assertThat(sent.sessionId()).isEqualTo("session-7");
            assertThat(sent.latencyB()).isEqualTo(2.5);
            assertThat(sent.confidence()).isEqualTo(0.8);
            assertThat(sent.context()).containsEntry("page", "results");
        }
    }

    @Nested
    @DisplayName("flushing")
    class Flushing {

        @Test
        @DisplayName("should flush automatically when the batch size is reached")
        void shouldFlushOnBatchSize() {
            RecordingClient client = new RecordingClient();
            Collector collector = collector(client, 3);

            collector.submit(submission(1));
            collector.submit(submission(2));
            assertThat(client.count()).isZero();

            collector.submit(submission(3));

            assertThat(client.count()).isEqualTo(3);
            assertThat(collector.stats().submitted()).isEqualTo(3);
            assertThat(collector.stats().queueDepth()).isZero();
        }

        @Test
        @DisplayName("should send records in submission order")
        void shouldSendInOrder() {
            RecordingClient client = new RecordingClient();
            Collector collector = collector(client, 100);
            for (int i = 0; i < 20; i++) {
                collector.submit(submission(i));
            }

            assertThat(collector.flush()).isEqualTo(20);

            List<String> prompts = client.getReceived().stream()
                    .map(r -> r.submission().prompt())
                    .collect(Collectors.toList());
            for (int i = 0; i < 20; i++) {
                assertThat(prompts.get(i)).isEqualTo(submission(i).prompt());
            }
        }

        @Test
        @DisplayName("should return zero when flushing an empty queue")
        void shouldFlushEmptyQueue() {
            Collector collector = collector(new RecordingClient(), 10);

            assertThat(collector.flush()).isZero();
        }

        @Test
        @DisplayName("should count failed sends and drop the records")
        void shouldCountFailures() {
            RecordingClient client = RecordingClient.failing(ErrorType.STORE_ERROR);
            Collector collector = collector(client, 10);
            collector.submit(submission(1));
            collector.submit(submission(2));

            assertThat(collector.flush()).isZero();

            CollectorStats stats = collector.stats();
            assertThat(stats.failed()).isEqualTo(2);
            assertThat(stats.submitted()).isZero();
            assertThat(stats.queueDepth()).isZero();
            // Not retried
            assertThat(collector.flush()).isZero();
            assertThat(client.count()).isEqualTo(2);
        }

        @Test
        @DisplayName("should survive a client that throws")
        void shouldSurviveThrowingClient() {
            RecordingClient client = RecordingClient.throwing();
            Collector collector = collector(client, 2);
            collector.submit(submission(1));

            assertThatCode(() -> collector.submit(submission(2))).doesNotThrowAnyException();

            assertThat(collector.stats().failed()).isEqualTo(2);
        }

        @Test
        @DisplayName("should keep sending after a failure in the same flush")
        void shouldContinueAfterFailure() {
            RecordingClient client = new RecordingClient(record ->
                    record.submission().prompt().contains("number 2 ")
                            ? SendResult.failure(ErrorType.CLIENT_ERROR, "bad record")
                            : SendResult.success("h"));
            Collector collector = collector(client, 100);
            for (int i = 1; i <= 3; i++) {
                collector.submit(submission(i));
            }

            assertThat(collector.flush()).isEqualTo(2);
            assertThat(collector.stats().failed()).isEqualTo(1);
        }

        @Test
        @DisplayName("should flush in the background at the configured interval")
        void shouldFlushInBackground() throws InterruptedException {
            RecordingClient client = new RecordingClient();
            Collector collector = Collector.builder()
                    .domain("test_domain")
                    .client(client)
                    .batchSize(100)
                    .flushInterval(Duration.ofMillis(50))
                    .build();
            collectors.add(collector);
            assertThat(collector.isAutoFlushRunning()).isTrue();

            collector.submit(submission(1));

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (client.count() == 0 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertThat(client.count()).isEqualTo(1);
            assertThat(collector.stats().submitted()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should drain the queue on stop")
        void shouldDrainOnStop() {
            RecordingClient client = new RecordingClient();
            Collector collector = collector(client, 10);
            for (int i = 0; i < 4; i++) {
                collector.submit(submission(i));
            }

            collector.stop();

            assertThat(client.count()).isEqualTo(4);
            assertThat(collector.stats().submitted()).isEqualTo(4);
            assertThat(collector.stats().queueDepth()).isZero();
            assertThat(collector.isStopped()).isTrue();
        }

        @Test
        @DisplayName("should only stop once")
        void shouldStopOnce() {
            RecordingClient client = new RecordingClient();
            Collector collector = collector(client, 10);
            collector.submit(submission(1));

            collector.stop();
            collector.stop();
            collector.close();

            assertThat(client.count()).isEqualTo(1);
        }

        @Test
        @DisplayName("should stop the background flusher")
        void shouldStopBackgroundFlusher() {
            Collector collector = Collector.builder()
                    .domain("test_domain")
                    .client(new RecordingClient())
                    .flushInterval(Duration.ofMillis(50))
                    .build();

            collector.stop();

            assertThat(collector.isAutoFlushRunning()).isFalse();
        }

        @Test
        @DisplayName("should still accept and flush explicitly after stop")
        void shouldAcceptAfterStop() {
            RecordingClient client = new RecordingClient();
            Collector collector = collector(client, 10);
            collector.stop();

            assertThat(collector.submit(submission(1))).isTrue();
            assertThat(collector.flush()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("builder")
    class BuilderValidation {

        @Test
        @DisplayName("should require a client")
        void shouldRequireClient() {
            assertThatThrownBy(() -> Collector.builder().domain("d").build())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("RemoteClient");
        }

        @Test
        @DisplayName("should require a domain")
        void shouldRequireDomain() {
            assertThatThrownBy(() -> Collector.builder().client(new RecordingClient()).build())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Domain");
        }

        @Test
        @DisplayName("should reject a non-positive batch size")
        void shouldRejectBatchSize() {
            assertThatThrownBy(() -> Collector.builder().batchSize(0))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should apply custom thresholds")
        void shouldApplyThresholds() {
            Collector collector = Collector.builder()
                    .domain("test_domain")
                    .client(new RecordingClient())
                    .thresholds(new QualityGate.Thresholds(1, 1, 100, 0.0, 1.5))
                    .autoFlush(false)
                    .build();
            collectors.add(collector);

            assertThat(collector.getQualityGate().getThresholds().minResponseLength()).isEqualTo(1);
            assertThat(collector.submit("Hi?", "Paris", "Lyon", Preference.A, "user_1")).isTrue();
        }

        @Test
        @DisplayName("should take gate and deduplication settings from configuration")
        void shouldApplyConfiguration() {
            CollectorConfig config = new ConfigLoader("test-collector.yaml", Map.of()).load();
            Collector collector = Collector.builder()
                    .fromConfig(config)
                    .client(new RecordingClient())
                    .build();
            collectors.add(collector);

            assertThat(collector.getDomain()).isEqualTo("test_domain");
            assertThat(collector.getBatchSize()).isEqualTo(3);
            assertThat(collector.isQualityGateEnabled()).isTrue();
            assertThat(collector.isAutoFlushRunning()).isFalse();
            assertThat(collector.getQualityGate().getThresholds().minResponseLength()).isEqualTo(20);
            assertThat(collector.getDedupCache().getMaxSize()).isEqualTo(100);
            assertThat(collector.getDedupCache().getPolicy()).isEqualTo(EvictionPolicy.HALF);
        }
    }

    @Test
    @DisplayName("should keep the stats invariant across mixed outcomes")
    void shouldKeepStatsInvariant() {
        RecordingClient client = new RecordingClient(record ->
                record.submission().producerId().equals("user_0")
                        ? SendResult.failure(ErrorType.TIMEOUT, "slow")
                        : SendResult.success("h"));
        Collector collector = collector(client, 4);

        for (int i = 0; i < 15; i++) {
            collector.submit(submission(i));
        }
        collector.submit(submission(3));
        collector.submit(submission(4));
        collector.submit(ComparisonSubmission.of("Short", "x", "y", Preference.A, "user_1"));

        CollectorStats stats = collector.stats();
        assertThat(stats.collected()).isEqualTo(18);
        assertThat(stats.rejectedDuplicate()).isEqualTo(2);
        assertThat(stats.rejectedQuality()).isEqualTo(1);
        assertThat(stats.failed()).isGreaterThan(0);
        assertThat(stats.accountedFor()).isEqualTo(stats.collected());

        collector.stop();

        CollectorStats finalStats = collector.stats();
        assertThat(finalStats.queueDepth()).isZero();
        assertThat(finalStats.submitted() + finalStats.failed()).isEqualTo(15);
        assertThat(finalStats.accountedFor()).isEqualTo(finalStats.collected());
    }

    @Test
    @DisplayName("should accept the capital of France comparison end to end")
    void shouldAcceptFranceComparison() {
        RecordingClient client = new RecordingClient();
        Collector collector = collector(client, 10);

        boolean accepted = collector.submit(
                "What is the capital of France?",
                "The capital of France is Paris. It is located on the Seine River and is known for landmarks like the Eiffel Tower.",
                "Paris is the capital of France and its most populous city, home to the Louvre and Notre-Dame.",
                Preference.A,
                "user_fr"
        );
        collector.stop();

        assertThat(accepted).isTrue();
        CollectorStats stats = collector.stats();
        assertThat(stats.rejectedQuality()).isZero();
        assertThat(stats.submitted()).isEqualTo(1);
        assertThat(stats.acceptanceRate()).isEqualTo(1.0);
        assertThat(client.getReceived().get(0).category()).isEqualTo("general");
    }

    @Test
    @DisplayName("should handle concurrent producers without losing records")
    void shouldHandleConcurrentProducers() throws Exception {
        RecordingClient client = new RecordingClient();
        Collector collector = collector(client, 10);
        int producers = 4;
        int perProducer = 50;
        ExecutorService executor = Executors.newFixedThreadPool(producers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int p = 0; p < producers; p++) {
                int offset = p * perProducer;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perProducer; i++) {
                        collector.submit(submission(offset + i));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        collector.stop();

        CollectorStats stats = collector.stats();
        assertThat(stats.collected()).isEqualTo(200);
        assertThat(stats.submitted()).isEqualTo(200);
        assertThat(stats.queueDepth()).isZero();
        Set<String> ids = client.getReceived().stream()
                .map(QueuedRecord::recordId)
                .collect(Collectors.toSet());
        assertThat(ids).hasSize(200);
    }

    @Test
    @DisplayName("should mirror outcomes into a shared metrics registry")
    void shouldMirrorMetrics() {
        MetricsRegistry metrics = new MetricsRegistry("mirror", false);
        try {
            Collector collector = Collector.builder()
                    .domain("test_domain")
                    .client(new RecordingClient())
                    .metricsRegistry(metrics)
                    .autoFlush(false)
                    .build();
            collector.submit(submission(1));
            collector.submit(submission(1));
            collector.stop();

            assertThat(metrics.getRegistry().get("mirror_submissions_total")
                    .tag("outcome", "accepted").counter().count()).isEqualTo(1.0);
            assertThat(metrics.getRegistry().get("mirror_submissions_total")
                    .tag("outcome", "rejected_duplicate").counter().count()).isEqualTo(1.0);
            assertThat(metrics.getRegistry().get("mirror_sends_total")
                    .tag("result", "success").counter().count()).isEqualTo(1.0);
        } finally {
            metrics.close();
        }
    }
}
