/**
 * Submission pipeline.
 *
 * <p>Producers hand comparisons to a {@link fr.lapetina.preferences.collector.pipeline.Collector},
 * which runs them through the quality gate and the deduplication cache before queueing them:
 * <pre>
 * QualityGate → DeduplicationCache → SubmissionQueue → RemoteClient
 * </pre>
 *
 * <p>The queue is drained when it reaches the batch size (on the submitting thread),
 * on a timer by the {@link fr.lapetina.preferences.collector.pipeline.BackgroundFlusher},
 * on an explicit {@code flush()}, and once more on {@code stop()}.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.preferences.collector.pipeline.Collector} - Orchestrator and counters</li>
 *   <li>{@link fr.lapetina.preferences.collector.pipeline.SubmissionQueue} - FIFO of accepted records</li>
 *   <li>{@link fr.lapetina.preferences.collector.pipeline.BackgroundFlusher} - Periodic drain</li>
 * </ul>
 */
package fr.lapetina.preferences.collector.pipeline;
