/**
 * Configuration loading.
 *
 * <p>Configuration is read from a YAML file (file system first, classpath second) and
 * then overridden by environment variables, so a deployment can tune batching and
 * credentials without editing the file.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.preferences.collector.infrastructure.config.CollectorConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.preferences.collector.infrastructure.config.ConfigLoader} - YAML loading and overrides</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code collector} - Domain, batch size, flush interval, quality gate and background flush switches</li>
 *   <li>{@code qualityGate} - Length and ratio thresholds</li>
 *   <li>{@code deduplication} - Cache size and eviction policy</li>
 *   <li>{@code store} - Preference store URL, API key, timeouts, circuit breaker</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.preferences.collector.infrastructure.config.ConfigLoader
 */
package fr.lapetina.preferences.collector.infrastructure.config;
