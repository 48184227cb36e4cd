/**
 * Platform adapters.
 *
 * <p>Each adapter owns a {@link fr.lapetina.preferences.collector.pipeline.Collector}
 * for its platform's domain and builds prompts from platform events.
 */
package fr.lapetina.preferences.collector.integration;
