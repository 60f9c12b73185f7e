package dev.mars.eventfold.core.config;

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

import dev.mars.eventfold.core.retry.BackoffStrategy;
import dev.mars.eventfold.core.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.regex.Pattern;

/**
 * Layered configuration for EventFold.
 *
 * Sources, lowest precedence first:
 * <ol>
 *   <li>{@code /eventfold-default.properties} on the classpath</li>
 *   <li>{@code /eventfold-<profile>.properties} when the profile is not {@code default}</li>
 *   <li>environment variables {@code EVENTFOLD_*}: lower-cased, {@code __} becomes {@code -}
 *       and {@code _} becomes {@code .}, so {@code EVENTFOLD_RETRY_MAX__ATTEMPTS} sets
 *       {@code eventfold.retry.max-attempts}</li>
 *   <li>system properties {@code eventfold.*}</li>
 *   <li>explicit overrides passed to the constructor</li>
 * </ol>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class EventFoldConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(EventFoldConfiguration.class);

    public static final String RETRY_MAX_ATTEMPTS = "eventfold.retry.max-attempts";
    public static final String RETRY_BACKOFF_STRATEGY = "eventfold.retry.backoff-strategy";
    public static final String RETRY_INITIAL_DELAY = "eventfold.retry.initial-delay";
    public static final String RETRY_MAX_DELAY = "eventfold.retry.max-delay";
    public static final String RETRY_MULTIPLIER = "eventfold.retry.multiplier";
    public static final String SNAPSHOT_ENABLED = "eventfold.snapshot.enabled";
    public static final String PG_HOST = "eventfold.pg.host";
    public static final String PG_PORT = "eventfold.pg.port";
    public static final String PG_DATABASE = "eventfold.pg.database";
    public static final String PG_USERNAME = "eventfold.pg.username";
    public static final String PG_PASSWORD = "eventfold.pg.password";
    public static final String PG_POOL_SIZE = "eventfold.pg.pool-size";
    public static final String PG_TABLE = "eventfold.pg.table";

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private final Properties properties;
    private final String profile;

    public EventFoldConfiguration() {
        this(getActiveProfile());
    }

    public EventFoldConfiguration(String profile) {
        this(profile, new Properties());
    }

    /**
     * Creates a configuration whose explicit overrides win over every other source, without
     * touching system properties.
     *
     * @param profile the configuration profile to use
     * @param overrides properties applied last
     */
    public EventFoldConfiguration(String profile, Properties overrides) {
        this(profile, System.getenv(), System.getProperties(), overrides);
    }

    EventFoldConfiguration(String profile, Map<String, String> environment, Properties systemProperties,
                           Properties overrides) {
        this.profile = profile;
        this.properties = loadProperties(profile, environment, systemProperties);
        overrides.forEach((key, value) -> properties.setProperty(key.toString(), value.toString()));
        validateConfiguration();
        logger.info("Loaded EventFold configuration for profile: {}", profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("eventfold.profile",
               System.getenv("EVENTFOLD_PROFILE") != null ? System.getenv("EVENTFOLD_PROFILE") : "default");
    }

    private Properties loadProperties(String profile, Map<String, String> environment, Properties systemProperties) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/eventfold-default.properties");

        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/eventfold-" + profile + ".properties");
        }

        environment.forEach((key, value) -> {
            if (key.startsWith("EVENTFOLD_")) {
                props.setProperty(toPropertyKey(key), value);
            }
        });

        // System properties last so that -D wins over the environment
        systemProperties.forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("eventfold.")) {
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

        validateRetryConfig(errors);
        validatePgConfig(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.debug("Configuration validation passed");
    }

    private void validateRetryConfig(List<String> errors) {
        if (getInt(RETRY_MAX_ATTEMPTS, 10) < 1) {
            errors.add("Retry max attempts must be at least 1");
        }

        String strategy = getString(RETRY_BACKOFF_STRATEGY, BackoffStrategy.EXPONENTIAL.name());
        try {
            BackoffStrategy.valueOf(strategy.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            errors.add("Retry backoff strategy must be FIXED or EXPONENTIAL");
        }

        Duration initialDelay = getDuration(RETRY_INITIAL_DELAY, Duration.ofMillis(10));
        Duration maxDelay = getDuration(RETRY_MAX_DELAY, Duration.ofSeconds(1));
        if (initialDelay.isNegative()) {
            errors.add("Retry initial delay must not be negative");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            errors.add("Retry max delay must not be shorter than the initial delay");
        }

        if (getDouble(RETRY_MULTIPLIER, 2.0) < 1.0) {
            errors.add("Retry multiplier must be at least 1.0");
        }
    }

    private void validatePgConfig(List<String> errors) {
        int port = getInt(PG_PORT, 5432);
        if (port < 1 || port > 65535) {
            errors.add("Database port must be between 1 and 65535");
        }

        if (getInt(PG_POOL_SIZE, 8) < 1) {
            errors.add("Pool size must be at least 1");
        }

        if (!TABLE_NAME.matcher(getString(PG_TABLE, "eventfold_envelopes")).matches()) {
            errors.add("Table name must be a plain SQL identifier");
        }
    }

    // Configuration getters with defaults
    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public String getString(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalArgumentException("Required configuration property not found: " + key);
        }
        return value;
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

    public double getDouble(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid double value for {}: {}, using default: {}", key, value, defaultValue);
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

    /**
     * Reads a duration given either in ISO-8601 ({@code PT0.5S}) or as plain milliseconds.
     */
    public Duration getDuration(String key, Duration defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        String trimmed = value.trim();
        try {
            if (DIGITS.matcher(trimmed).matches()) {
                return Duration.ofMillis(Long.parseLong(trimmed));
            }
            return Duration.parse(trimmed);
        } catch (RuntimeException e) {
            logger.warn("Invalid duration value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    // Specific configuration builders
    public RetryConfig getRetryConfig() {
        return RetryConfig.builder()
            .maxAttempts(getInt(RETRY_MAX_ATTEMPTS, 10))
            .backoffStrategy(BackoffStrategy.valueOf(
                getString(RETRY_BACKOFF_STRATEGY, BackoffStrategy.EXPONENTIAL.name()).trim().toUpperCase(Locale.ROOT)))
            .initialDelay(getDuration(RETRY_INITIAL_DELAY, Duration.ofMillis(10)))
            .maxDelay(getDuration(RETRY_MAX_DELAY, Duration.ofSeconds(1)))
            .multiplier(getDouble(RETRY_MULTIPLIER, 2.0))
            .build();
    }

    public boolean isSnapshotEnabled() {
        return getBoolean(SNAPSHOT_ENABLED, true);
    }

    public String getProfile() {
        return profile;
    }
}
