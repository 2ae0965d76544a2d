/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.common.config;

import io.kubesim.common.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static io.kubesim.common.config.ConfigParameterParser.BOOLEAN;
import static io.kubesim.common.config.ConfigParameterParser.INSTANT;
import static io.kubesim.common.config.ConfigParameterParser.INTEGER;
import static io.kubesim.common.config.ConfigParameterParser.NON_EMPTY_STRING;
import static io.kubesim.common.config.ConfigParameterParser.nonNegative;
import static io.kubesim.common.config.ConfigParameterParser.oneOf;
import static io.kubesim.common.config.ConfigParameterParser.strictlyPositive;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ConfigParameterTest {
    private static final Map<String, ConfigParameter<?>> PARAMETERS = new HashMap<>();
    private static final ConfigParameter<Integer> TICKS = new ConfigParameter<>("TEST_TICKS", strictlyPositive(INTEGER), "3", PARAMETERS);
    private static final ConfigParameter<Integer> DELAY = new ConfigParameter<>("TEST_DELAY", nonNegative(INTEGER), "0", PARAMETERS);
    private static final ConfigParameter<Boolean> ENABLED = new ConfigParameter<>("TEST_ENABLED", BOOLEAN, "false", PARAMETERS);
    private static final ConfigParameter<String> OPTIONAL = new ConfigParameter<>("TEST_OPTIONAL", ConfigParameterParser.STRING, null, PARAMETERS);
    private static final ConfigParameter<String> MODE = new ConfigParameter<>("TEST_MODE", oneOf("FirstFit", "LeastAllocated"), "FirstFit", PARAMETERS);
    private static final ConfigParameter<Instant> START = new ConfigParameter<>("TEST_START", INSTANT, "2024-01-01T00:00:00Z", PARAMETERS);

    @Test
    public void testDefaults() {
        Map<String, Object> values = ConfigParameter.define(Map.of(), PARAMETERS);

        assertThat(values.get(TICKS.key()), is(3));
        assertThat(values.get(DELAY.key()), is(0));
        assertThat(values.get(ENABLED.key()), is(false));
        assertThat(values.get(OPTIONAL.key()), is(nullValue()));
        assertThat(values.get(MODE.key()), is("FirstFit"));
        assertThat(values.get(START.key()), is(Instant.parse("2024-01-01T00:00:00Z")));
    }

    @Test
    public void testUserValues() {
        Map<String, Object> values = ConfigParameter.define(Map.of("TEST_TICKS", "5", "TEST_ENABLED", "TRUE", "TEST_MODE", "leastallocated", "TEST_DELAY", ""), PARAMETERS);

        assertThat(values.get(TICKS.key()), is(5));
        assertThat(values.get(ENABLED.key()), is(true));
        assertThat(values.get(MODE.key()), is("LeastAllocated"));
        // Empty value falls back to the default
        assertThat(values.get(DELAY.key()), is(0));
    }

    @Test
    public void testInvalidValues() {
        assertThrows(InvalidConfigurationException.class, () -> ConfigParameter.define(Map.of("TEST_TICKS", "0"), PARAMETERS));
        assertThrows(InvalidConfigurationException.class, () -> ConfigParameter.define(Map.of("TEST_TICKS", "abc"), PARAMETERS));
        assertThrows(InvalidConfigurationException.class, () -> ConfigParameter.define(Map.of("TEST_DELAY", "-1"), PARAMETERS));
        assertThrows(InvalidConfigurationException.class, () -> ConfigParameter.define(Map.of("TEST_ENABLED", "yes"), PARAMETERS));
        assertThrows(InvalidConfigurationException.class, () -> ConfigParameter.define(Map.of("TEST_MODE", "Random"), PARAMETERS));
        assertThrows(InvalidConfigurationException.class, () -> ConfigParameter.define(Map.of("TEST_START", "yesterday"), PARAMETERS));
        assertThrows(InvalidConfigurationException.class, () -> ConfigParameter.define(Map.of("TEST_UNKNOWN", "1"), PARAMETERS));
    }

    @Test
    public void testRequiredValue() {
        Map<String, ConfigParameter<?>> parameters = new HashMap<>();
        new ConfigParameter<>("TEST_REQUIRED", NON_EMPTY_STRING, parameters);

        assertThrows(InvalidConfigurationException.class, () -> ConfigParameter.define(Map.of(), parameters));
        assertThat(ConfigParameter.define(Map.of("TEST_REQUIRED", "value"), parameters).get("TEST_REQUIRED"), is("value"));
    }
}
