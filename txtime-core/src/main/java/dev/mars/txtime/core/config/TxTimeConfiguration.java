package dev.mars.txtime.core.config;

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

import dev.mars.txtime.core.mutation.RecoveryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.UUID;

/**
 * Configuration management for TxTime.
 *
 * <p>Sources are applied in order, later ones winning:</p>
 * <ol>
 *   <li>{@code /txtime-default.properties} on the classpath</li>
 *   <li>{@code /txtime-<profile>.properties} for a non-default profile</li>
 *   <li>{@code TXTIME_*} environment variables ({@code _} becomes {@code .}, {@code __} becomes {@code -},
 *       so {@code TXTIME_MUTATION_YIELD__INTERVAL} sets {@code txtime.mutation.yield-interval})</li>
 *   <li>{@code txtime.*} system properties</li>
 *   <li>explicit overrides passed to the constructor</li>
 * </ol>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-12-02
 * @version 1.0
 */
public class TxTimeConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(TxTimeConfiguration.class);

    public static final String YIELD_INTERVAL = "txtime.mutation.yield-interval";
    public static final String INSERT_RETRIES = "txtime.mutation.insert-retries";
    public static final String RECOVERY_POLICY = "txtime.mutation.recovery-policy";
    public static final String MAX_DOCUMENT_SIZE = "txtime.document.max-size-bytes";
    public static final String PURGE_ENABLED = "txtime.purge.enabled";
    public static final String PURGE_INTERVAL = "txtime.purge.interval";
    public static final String METRICS_ENABLED = "txtime.metrics.enabled";
    public static final String METRICS_INSTANCE_ID = "txtime.metrics.instance-id";
    public static final String CURSOR_TIMEOUT = "txtime.memory.cursor-timeout";
    public static final String REUSE_SLOTS = "txtime.memory.reuse-slots";

    private final Properties properties;
    private final String profile;

    public TxTimeConfiguration() {
        this(getActiveProfile());
    }

    public TxTimeConfiguration(String profile) {
        this(profile, new Properties());
    }

    /**
     * Creates a configuration with explicit overrides applied last, without touching
     * System properties.
     *
     * @param profile the configuration profile to use
     * @param overrides properties that win over every other source
     */
    public TxTimeConfiguration(String profile, Properties overrides) {
        this.profile = profile;
        this.properties = loadProperties(profile);
        overrides.forEach((key, value) -> properties.setProperty(key.toString(), value.toString()));
        validateConfiguration();
        logger.info("Loaded TxTime configuration for profile: {}", profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("txtime.profile",
               System.getenv("TXTIME_PROFILE") != null ? System.getenv("TXTIME_PROFILE") : "default");
    }

    private Properties loadProperties(String profile) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/txtime-default.properties");

        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/txtime-" + profile + ".properties");
        }

        System.getenv().forEach((key, value) -> {
            if (key.startsWith("TXTIME_") && !"TXTIME_PROFILE".equals(key)) {
                props.setProperty(toPropertyKey(key), value);
            }
        });

        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("txtime.")) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    static String toPropertyKey(String environmentKey) {
        return environmentKey.toLowerCase(Locale.ROOT).replace("__", "-").replace('_', '.');
    }

    private void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties from: {}", resourcePath, e);
        }
    }

    private void validateConfiguration() {
        List<String> errors = new ArrayList<>();

        validateMutationConfig(errors);
        validatePurgeConfig(errors);
        validateMemoryStoreConfig(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.debug("Configuration validation passed");
    }

    private void validateMutationConfig(List<String> errors) {
        if (getInt(YIELD_INTERVAL, 128) < 1) {
            errors.add("Yield interval must be at least 1");
        }

        int retries = getInt(INSERT_RETRIES, 2);
        if (retries < 0 || retries > 10) {
            errors.add("Insert retries must be between 0 and 10");
        }

        String policy = getString(RECOVERY_POLICY, RecoveryPolicy.COMPENSATE.name());
        try {
            RecoveryPolicy.valueOf(policy.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            errors.add("Recovery policy must be one of COMPENSATE, SURFACE but was " + policy);
        }

        if (getInt(MAX_DOCUMENT_SIZE, 16 * 1024 * 1024) < 1024) {
            errors.add("Maximum document size must be at least 1024 bytes");
        }
    }

    private void validatePurgeConfig(List<String> errors) {
        if (getBoolean(PURGE_ENABLED, true)) {
            Duration interval = getDuration(PURGE_INTERVAL, Duration.ofSeconds(60));
            if (interval.toMillis() < 1000) {
                errors.add("Purge interval must be at least 1 second");
            }
        }
    }

    private void validateMemoryStoreConfig(List<String> errors) {
        Duration timeout = getDuration(CURSOR_TIMEOUT, Duration.ofMinutes(10));
        if (timeout.isNegative() || timeout.isZero()) {
            errors.add("Cursor timeout must be positive");
        }
    }

    // Configuration getters with defaults
    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public Duration getDuration(String key, Duration defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Duration.parse(value.trim());
        } catch (Exception e) {
            logger.warn("Invalid duration value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    // Specific configuration builders
    public MutationConfig getMutationConfig() {
        return new MutationConfig(
            getInt(YIELD_INTERVAL, 128),
            getInt(INSERT_RETRIES, 2),
            RecoveryPolicy.valueOf(getString(RECOVERY_POLICY, "COMPENSATE").trim().toUpperCase(Locale.ROOT)),
            getInt(MAX_DOCUMENT_SIZE, 16 * 1024 * 1024)
        );
    }

    public PurgeConfig getPurgeConfig() {
        return new PurgeConfig(
            getBoolean(PURGE_ENABLED, true),
            getDuration(PURGE_INTERVAL, Duration.ofSeconds(60))
        );
    }

    public MetricsConfig getMetricsConfig() {
        return new MetricsConfig(
            getBoolean(METRICS_ENABLED, true),
            getString(METRICS_INSTANCE_ID, "txtime-" + UUID.randomUUID().toString().substring(0, 8))
        );
    }

    public MemoryStoreConfig getMemoryStoreConfig() {
        return new MemoryStoreConfig(
            getDuration(CURSOR_TIMEOUT, Duration.ofMinutes(10)),
            getBoolean(REUSE_SLOTS, true)
        );
    }

    // Configuration data classes
    public static class MutationConfig {
        private final int yieldInterval;
        private final int insertRetries;
        private final RecoveryPolicy recoveryPolicy;
        private final int maxDocumentSize;

        public MutationConfig(int yieldInterval, int insertRetries, RecoveryPolicy recoveryPolicy, int maxDocumentSize) {
            this.yieldInterval = Math.max(1, yieldInterval);
            this.insertRetries = insertRetries;
            this.recoveryPolicy = recoveryPolicy;
            this.maxDocumentSize = maxDocumentSize;
        }

        public int getYieldInterval() { return yieldInterval; }
        public int getInsertRetries() { return insertRetries; }
        public RecoveryPolicy getRecoveryPolicy() { return recoveryPolicy; }
        public int getMaxDocumentSize() { return maxDocumentSize; }
    }

    public static class PurgeConfig {
        private final boolean enabled;
        private final Duration interval;

        public PurgeConfig(boolean enabled, Duration interval) {
            this.enabled = enabled;
            this.interval = interval;
        }

        public boolean isEnabled() { return enabled; }
        public Duration getInterval() { return interval; }
    }

    public static class MetricsConfig {
        private final boolean enabled;
        private final String instanceId;

        public MetricsConfig(boolean enabled, String instanceId) {
            this.enabled = enabled;
            this.instanceId = instanceId;
        }

        public boolean isEnabled() { return enabled; }
        public String getInstanceId() { return instanceId; }
    }

    public static class MemoryStoreConfig {
        private final Duration cursorTimeout;
        private final boolean reuseSlots;

        public MemoryStoreConfig(Duration cursorTimeout, boolean reuseSlots) {
            this.cursorTimeout = cursorTimeout;
            this.reuseSlots = reuseSlots;
        }

        public Duration getCursorTimeout() { return cursorTimeout; }
        public boolean isReuseSlots() { return reuseSlots; }
    }

    public String getProfile() { return profile; }
    public Properties getProperties() {
        Properties copy = new Properties();
        copy.putAll(properties);
        return copy;
    }
}
