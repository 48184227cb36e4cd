/**
 * Preference Collector - gathers pairwise preference comparisons from platform users
 * and forwards the ones worth keeping to a remote preference store.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.preferences.collector.CollectorFactory} - Main entry point for creating
 *       a fully-configured collector from YAML configuration</li>
 *   <li>{@link fr.lapetina.preferences.collector.pipeline.Collector} - Submission pipeline</li>
 *   <li>{@link fr.lapetina.preferences.collector.integration} - Per-platform adapters</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (CollectorFactory factory = CollectorFactory.create("collector.yaml")) {
 *     Collector collector = factory.getCollector();
 *
 *     boolean accepted = collector.submit(
 *             "What is the capital of France?",
 *             responseA, responseB, Preference.A, "user_42");
 *
 *     CollectorStats stats = collector.stats();
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Quality gate with specific rejection reasons</li>
 *   <li>Bounded deduplication cache (LRU or half eviction)</li>
 *   <li>Batch and timer driven flushing with a final drain on stop</li>
 *   <li>Circuit breaker in front of the preference store</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.preferences.collector.CollectorFactory
 * @see fr.lapetina.preferences.collector.pipeline.Collector
 */
package fr.lapetina.preferences.collector;
