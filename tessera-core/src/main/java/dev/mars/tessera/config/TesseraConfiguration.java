/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.tessera.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;

/**
 * Configuration management for the Tessera engine.
 * <p>
 * Values are resolved in increasing precedence: built-in defaults, a {@code tessera.properties}
 * classpath resource, the file named by the {@code tessera.config.file} system property,
 * and finally any system property starting with {@code tessera.}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TesseraConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(TesseraConfiguration.class);

    public static final String CONFIG_FILE_PROPERTY = "tessera.config.file";
    public static final String CLASSPATH_RESOURCE = "tessera.properties";

    public static final String MAX_CONCURRENT_WORKFLOWS = "tessera.engine.max.concurrent.workflows";
    public static final String STEP_TIMEOUT_MS = "tessera.engine.step.timeout.ms";
    public static final String STEP_WORKERS = "tessera.engine.step.workers";
    public static final String RETRY_MAX = "tessera.engine.retry.max";
    public static final String RETRY_BASE_DELAY_MS = "tessera.engine.retry.base.delay.ms";
    public static final String RETRY_MAX_DELAY_MS = "tessera.engine.retry.max.delay.ms";
    public static final String EVENT_HISTORY_SIZE = "tessera.events.history.size";
    public static final String STATE_CLEANUP_INTERVAL_MS = "tessera.state.cleanup.interval.ms";
    public static final String STATE_MAX_AGE_MS = "tessera.state.max.age.ms";
    public static final String STATE_DIRECTORY = "tessera.state.directory";
    public static final String METRICS_ENABLED = "tessera.monitoring.metrics.enabled";

    // Default configuration values
    private static final int DEFAULT_MAX_CONCURRENT_WORKFLOWS = 10;
    private static final long DEFAULT_STEP_TIMEOUT_MS = 300_000;
    private static final int DEFAULT_STEP_WORKERS = 8;
    private static final int DEFAULT_RETRY_MAX = 3;
    private static final long DEFAULT_RETRY_BASE_DELAY_MS = 1000;
    private static final long DEFAULT_RETRY_MAX_DELAY_MS = 60_000;
    private static final int DEFAULT_EVENT_HISTORY_SIZE = 1000;
    private static final long DEFAULT_STATE_CLEANUP_INTERVAL_MS = 3_600_000; // 1 hour
    private static final long DEFAULT_STATE_MAX_AGE_MS = 86_400_000; // 24 hours

    private final Properties properties;

    public TesseraConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromClasspath();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    /**
     * Creates a configuration from defaults overlaid with the given properties only.
     * No classpath, file or system property sources are consulted.
     */
    public TesseraConfiguration(Properties overrides) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (overrides != null) {
            this.properties.putAll(overrides);
        }
    }

    // Engine configuration
    public int getMaxConcurrentWorkflows() {
        return getIntProperty(MAX_CONCURRENT_WORKFLOWS, DEFAULT_MAX_CONCURRENT_WORKFLOWS);
    }

    public Duration getDefaultStepTimeout() {
        return Duration.ofMillis(getLongProperty(STEP_TIMEOUT_MS, DEFAULT_STEP_TIMEOUT_MS));
    }

    public int getStepWorkers() {
        return getIntProperty(STEP_WORKERS, DEFAULT_STEP_WORKERS);
    }

    public int getMaxRetries() {
        return getIntProperty(RETRY_MAX, DEFAULT_RETRY_MAX);
    }

    public Duration getRetryBaseDelay() {
        return Duration.ofMillis(getLongProperty(RETRY_BASE_DELAY_MS, DEFAULT_RETRY_BASE_DELAY_MS));
    }

    public Duration getRetryMaxDelay() {
        return Duration.ofMillis(getLongProperty(RETRY_MAX_DELAY_MS, DEFAULT_RETRY_MAX_DELAY_MS));
    }

    // Event configuration
    public int getEventHistorySize() {
        return getIntProperty(EVENT_HISTORY_SIZE, DEFAULT_EVENT_HISTORY_SIZE);
    }

    // State configuration
    public Duration getStateCleanupInterval() {
        return Duration.ofMillis(getLongProperty(STATE_CLEANUP_INTERVAL_MS, DEFAULT_STATE_CLEANUP_INTERVAL_MS));
    }

    public Duration getStateMaxAge() {
        return Duration.ofMillis(getLongProperty(STATE_MAX_AGE_MS, DEFAULT_STATE_MAX_AGE_MS));
    }

    /**
     * @return the directory for file-backed state, or {@code null} for in-memory state
     */
    public Path getStateDirectory() {
        String value = properties.getProperty(STATE_DIRECTORY);
        if (value == null || value.isBlank()) {
            return null;
        }
        return Paths.get(value.trim());
    }

    // Monitoring configuration
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}",
                        key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}",
                        key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(MAX_CONCURRENT_WORKFLOWS, String.valueOf(DEFAULT_MAX_CONCURRENT_WORKFLOWS));
        properties.setProperty(STEP_TIMEOUT_MS, String.valueOf(DEFAULT_STEP_TIMEOUT_MS));
        properties.setProperty(STEP_WORKERS, String.valueOf(DEFAULT_STEP_WORKERS));
        properties.setProperty(RETRY_MAX, String.valueOf(DEFAULT_RETRY_MAX));
        properties.setProperty(RETRY_BASE_DELAY_MS, String.valueOf(DEFAULT_RETRY_BASE_DELAY_MS));
        properties.setProperty(RETRY_MAX_DELAY_MS, String.valueOf(DEFAULT_RETRY_MAX_DELAY_MS));
        properties.setProperty(EVENT_HISTORY_SIZE, String.valueOf(DEFAULT_EVENT_HISTORY_SIZE));
        properties.setProperty(STATE_CLEANUP_INTERVAL_MS, String.valueOf(DEFAULT_STATE_CLEANUP_INTERVAL_MS));
        properties.setProperty(STATE_MAX_AGE_MS, String.valueOf(DEFAULT_STATE_MAX_AGE_MS));
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromClasspath() {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath resource {}", CLASSPATH_RESOURCE);
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromFile() {
        String configFile = System.getProperty(CONFIG_FILE_PROPERTY);
        if (configFile == null || configFile.isBlank()) {
            return;
        }
        Path configPath = Paths.get(configFile.trim());
        if (!Files.isReadable(configPath)) {
            logger.warn("Configuration file {} does not exist or is not readable", configPath);
            return;
        }
        try (InputStream input = Files.newInputStream(configPath)) {
            properties.load(input);
            logger.info("Loaded configuration from: {}", configPath);
        } catch (IOException e) {
            logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("tessera."))
                .filter(entry -> !CONFIG_FILE_PROPERTY.equals(entry.getKey().toString()))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "TesseraConfiguration{" +
                "maxConcurrentWorkflows=" + getMaxConcurrentWorkflows() +
                ", stepWorkers=" + getStepWorkers() +
                ", maxRetries=" + getMaxRetries() +
                ", stateDirectory=" + getStateDirectory() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
