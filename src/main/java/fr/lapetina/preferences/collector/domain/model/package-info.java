/**
 * Domain model classes for preference ingestion.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.preferences.collector.domain.model.ComparisonSubmission} - Immutable comparison from a producer</li>
 *   <li>{@link fr.lapetina.preferences.collector.domain.model.QueuedRecord} - Accepted submission awaiting transmission</li>
 *   <li>{@link fr.lapetina.preferences.collector.domain.model.CollectorStats} - Snapshot of collector counters</li>
 *   <li>{@link fr.lapetina.preferences.collector.domain.model.Preference} - Chosen side (A, B, TIE)</li>
 *   <li>{@link fr.lapetina.preferences.collector.domain.model.ErrorType} - Categorized transmission failures</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>All types in this package are immutable records or enums and may be shared freely
 * between producer threads and the flusher.
 */
package fr.lapetina.preferences.collector.domain.model;
