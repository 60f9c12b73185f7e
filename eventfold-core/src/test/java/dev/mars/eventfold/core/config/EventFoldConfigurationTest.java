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
import dev.mars.eventfold.test.categories.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
@DisplayName("EventFold Configuration Tests")
class EventFoldConfigurationTest {

    private static Properties properties(String... keyValues) {
        Properties props = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            props.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return props;
    }

    private static EventFoldConfiguration load(String profile, Map<String, String> env, Properties system) {
        return new EventFoldConfiguration(profile, env, system, new Properties());
    }

    @Test
    @DisplayName("Should load the bundled defaults")
    void testDefaults() {
        EventFoldConfiguration config = load("default", Map.of(), new Properties());
        RetryConfig retry = config.getRetryConfig();

        assertEquals(10, retry.getMaxAttempts());
        assertEquals(BackoffStrategy.EXPONENTIAL, retry.getBackoffStrategy());
        assertEquals(Duration.ofMillis(10), retry.getInitialDelay());
        assertEquals(Duration.ofSeconds(1), retry.getMaxDelay());
        assertTrue(config.isSnapshotEnabled());
        assertEquals("eventfold_envelopes", config.getString(EventFoldConfiguration.PG_TABLE));
        assertEquals(5432, config.getInt(EventFoldConfiguration.PG_PORT, 0));
    }

    @Test
    @DisplayName("Should layer the profile file over the defaults")
    void testProfileOverridesDefaults() {
        EventFoldConfiguration config = load("test", Map.of(), new Properties());
        RetryConfig retry = config.getRetryConfig();

        assertEquals("test", config.getProfile());
        assertEquals(3, retry.getMaxAttempts());
        assertEquals(BackoffStrategy.FIXED, retry.getBackoffStrategy());
        assertEquals(Duration.ofMillis(5), retry.getInitialDelay());
        assertFalse(config.isSnapshotEnabled());
        assertEquals("localhost", config.getString(EventFoldConfiguration.PG_HOST));
    }

    @Test
    @DisplayName("Should apply environment over files and system properties over environment")
    void testPrecedence() {
        Map<String, String> env = Map.of(
            "EVENTFOLD_RETRY_MAX__ATTEMPTS", "7",
            "EVENTFOLD_PG_HOST", "db.internal",
            "OTHER_SETTING", "ignored");
        Properties system = properties(
            "eventfold.pg.host", "db.override",
            "unrelated.key", "ignored");

        EventFoldConfiguration config = load("test", env, system);

        assertEquals(7, config.getRetryConfig().getMaxAttempts());
        assertEquals("db.override", config.getString(EventFoldConfiguration.PG_HOST));
        assertNull(config.getString("unrelated.key", null));
    }

    @Test
    @DisplayName("Should let explicit overrides win over every other source")
    void testExplicitOverrides() {
        EventFoldConfiguration config = new EventFoldConfiguration("default",
            Map.of("EVENTFOLD_PG_PORT", "6000"), properties("eventfold.pg.port", "6001"),
            properties("eventfold.pg.port", "6002"));

        assertEquals(6002, config.getInt(EventFoldConfiguration.PG_PORT, 0));
    }

    @Test
    @DisplayName("Should map environment variable names to property keys")
    void testEnvironmentKeyMapping() {
        assertEquals("eventfold.retry.max-attempts", EventFoldConfiguration.toPropertyKey("EVENTFOLD_RETRY_MAX__ATTEMPTS"));
        assertEquals("eventfold.pg.pool-size", EventFoldConfiguration.toPropertyKey("EVENTFOLD_PG_POOL__SIZE"));
        assertEquals("eventfold.snapshot.enabled", EventFoldConfiguration.toPropertyKey("EVENTFOLD_SNAPSHOT_ENABLED"));
    }

    @Test
    @DisplayName("Should accept durations in ISO-8601 or milliseconds")
    void testDurations() {
        EventFoldConfiguration config = load("default", Map.of(), properties(
            "eventfold.retry.initial-delay", "250",
            "eventfold.retry.max-delay", "PT2S"));

        assertEquals(Duration.ofMillis(250), config.getRetryConfig().getInitialDelay());
        assertEquals(Duration.ofSeconds(2), config.getRetryConfig().getMaxDelay());
    }

    @Test
    @DisplayName("Should report every invalid setting at once")
    void testValidationCollectsErrors() {
        Properties invalid = properties(
            "eventfold.retry.max-attempts", "0",
            "eventfold.retry.backoff-strategy", "LINEAR",
            "eventfold.pg.port", "70000",
            "eventfold.pg.table", "events; drop table x");

        IllegalStateException exception = assertThrows(IllegalStateException.class,
            () -> load("default", Map.of(), invalid));

        assertTrue(exception.getMessage().contains("max attempts"));
        assertTrue(exception.getMessage().contains("backoff strategy"));
        assertTrue(exception.getMessage().contains("port"));
        assertTrue(exception.getMessage().contains("Table name"));
    }

    @Test
    @DisplayName("Should fail fast on a missing required property")
    void testRequiredProperty() {
        EventFoldConfiguration config = load("default", Map.of(), new Properties());

        assertThrows(IllegalArgumentException.class, () -> config.getString("eventfold.missing"));
        assertEquals(42, config.getInt("eventfold.missing", 42));
    }
}
