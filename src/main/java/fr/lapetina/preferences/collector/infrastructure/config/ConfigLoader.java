package fr.lapetina.preferences.collector.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration loader.
 *
 * Supports:
 * - Loading YAML from the file system, falling back to the classpath
 * - Environment-style overrides applied on top of the file
 *
 * Recognized overrides:
 * PREFERENCE_COLLECTOR_DOMAIN, PREFERENCE_COLLECTOR_BATCH_SIZE,
 * PREFERENCE_COLLECTOR_FLUSH_INTERVAL (seconds), PREFERENCE_COLLECTOR_QUALITY_GATE_ENABLED,
 * PREFERENCE_COLLECTOR_AUTO_FLUSH, PREFERENCE_STORE_URL, PREFERENCE_STORE_API_KEY.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_CONFIG = "collector.yaml";

    static final String ENV_DOMAIN = "PREFERENCE_COLLECTOR_DOMAIN";
    static final String ENV_BATCH_SIZE = "PREFERENCE_COLLECTOR_BATCH_SIZE";
    static final String ENV_FLUSH_INTERVAL = "PREFERENCE_COLLECTOR_FLUSH_INTERVAL";
    static final String ENV_QUALITY_GATE_ENABLED = "PREFERENCE_COLLECTOR_QUALITY_GATE_ENABLED";
    static final String ENV_AUTO_FLUSH = "PREFERENCE_COLLECTOR_AUTO_FLUSH";
    static final String ENV_STORE_URL = "PREFERENCE_STORE_URL";
    static final String ENV_STORE_API_KEY = "PREFERENCE_STORE_API_KEY";

    private final Path configPath;
    private final Map<String, String> environment;
    private final Yaml yaml;

    public ConfigLoader(String configPath, Map<String, String> environment) {
        this.configPath = Paths.get(configPath);
        this.environment = environment;
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(CollectorConfig.class, loaderOptions));
    }

    public ConfigLoader(String configPath) {
        this(configPath, System.getenv());
    }

    /**
     * Loads configuration from file or classpath and applies environment overrides.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading fails or an override is malformed
     */
    public CollectorConfig load() {
        CollectorConfig config = loadFromPath();
        applyOverrides(config);
        validate(config);
        return config;
    }

    /**
     * Loads configuration from an input stream and applies environment overrides.
     */
    public CollectorConfig loadFromStream(InputStream inputStream) {
        CollectorConfig config = parse(inputStream, "stream");
        applyOverrides(config);
        validate(config);
        return config;
    }

    private CollectorConfig loadFromPath() {
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream is = Files.newInputStream(configPath)) {
                return parse(is, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private CollectorConfig parse(InputStream is, String source) {
        try {
            CollectorConfig config = yaml.load(is);
            // An empty document yields null
            return config != null ? config : new CollectorConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    private void applyOverrides(CollectorConfig config) {
        CollectorConfig.CollectorSection collector = config.getCollector();

        String domain = env(ENV_DOMAIN);
        if (domain != null) {
            collector.setDomain(domain);
        }
        String batchSize = env(ENV_BATCH_SIZE);
        if (batchSize != null) {
            collector.setBatchSize(parseInt(ENV_BATCH_SIZE, batchSize));
        }
        String flushInterval = env(ENV_FLUSH_INTERVAL);
        if (flushInterval != null) {
            collector.setFlushIntervalSeconds(parseLong(ENV_FLUSH_INTERVAL, flushInterval));
        }
        String qualityGate = env(ENV_QUALITY_GATE_ENABLED);
        if (qualityGate != null) {
            collector.setQualityGateEnabled(parseBoolean(ENV_QUALITY_GATE_ENABLED, qualityGate));
        }
        String autoFlush = env(ENV_AUTO_FLUSH);
        if (autoFlush != null) {
            collector.setAutoFlush(parseBoolean(ENV_AUTO_FLUSH, autoFlush));
        }
        String storeUrl = env(ENV_STORE_URL);
        if (storeUrl != null) {
            config.getStore().setBaseUrl(storeUrl);
        }
        String apiKey = env(ENV_STORE_API_KEY);
        if (apiKey != null) {
            config.getStore().setApiKey(apiKey);
        }
    }

    private String env(String name) {
        String value = environment.get(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        log.debug("Applying environment override: {}", name);
        return value.trim();
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(name + " must be an integer, got: " + value, e);
        }
    }

    private static long parseLong(String name, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(name + " must be an integer, got: " + value, e);
        }
    }

    private static boolean parseBoolean(String name, String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> throw new ConfigurationException(name + " must be a boolean, got: " + value);
        };
    }

    private static void validate(CollectorConfig config) {
        CollectorConfig.CollectorSection collector = config.getCollector();
        if (collector.getBatchSize() < 1) {
            throw new ConfigurationException("collector.batchSize must be at least 1");
        }
        if (collector.getFlushIntervalSeconds() < 1) {
            throw new ConfigurationException("collector.flushIntervalSeconds must be at least 1");
        }
        if (collector.getDomain() == null || collector.getDomain().isBlank()) {
            throw new ConfigurationException("collector.domain is required");
        }
        if (config.getStore().getBaseUrl() == null || config.getStore().getBaseUrl().isBlank()) {
            throw new ConfigurationException("store.baseUrl is required");
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
