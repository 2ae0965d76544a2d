/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.common.config;

import io.kubesim.common.InvalidConfigurationException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Abstraction for things which convert a single configuration parameter value from a String to some specific type.
 */
public interface ConfigParameterParser<T> {

    /**
     * Parses the string based on its type
     *
     * @param configValue config value in String format
     * @throws InvalidConfigurationException if the given configuration value is not supported
     * @return the value based on its type
     */
    T parse(String configValue) throws InvalidConfigurationException;

    /**
     * A java string
     */
    ConfigParameterParser<String> STRING = configValue -> configValue;

    /**
     * A non empty java string
     */
    ConfigParameterParser<String> NON_EMPTY_STRING = configValue -> {
        if (configValue == null || configValue.isEmpty()) {
            throw new InvalidConfigurationException("Failed to parse. Value cannot be empty or null");
        } else {
            return configValue;
        }
    };

    /**
     * A Java Long
     */
    ConfigParameterParser<Long> LONG = configValue -> {
        try {
            return Long.parseLong(configValue.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Failed to parse. Value " + configValue + " is not valid", e);
        }
    };

    /**
     * A Java Integer
     */
    ConfigParameterParser<Integer> INTEGER = configValue -> {
        try {
            return Integer.parseInt(configValue.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Failed to parse. Value " + configValue + " is not valid", e);
        }
    };

    /**
     * A Java Boolean
     */
    ConfigParameterParser<Boolean> BOOLEAN = configValue -> {
        if (configValue.equalsIgnoreCase("true") || configValue.equalsIgnoreCase("false")) {
            return Boolean.parseBoolean(configValue);
        } else {
            throw new InvalidConfigurationException("Failed to parse. Value " + configValue + " is not valid");
        }
    };

    /**
     * A point in time in the ISO-8601 format (for example 2024-01-01T00:00:00Z)
     */
    ConfigParameterParser<Instant> INSTANT = configValue -> {
        try {
            return Instant.parse(configValue.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidConfigurationException("Failed to parse. Value " + configValue + " is not a valid ISO-8601 instant", e);
        }
    };

    /**
     * Strictly Positive Number
     *
     * @param parser ConfigParameterParser object
     * @param <T>    Type of parameter
     *
     * @return Positive number
     */
    static <T extends Number> ConfigParameterParser<T> strictlyPositive(ConfigParameterParser<T> parser) {
        return configValue -> {
            var value = parser.parse(configValue);
            if (value.longValue() <= 0) {
                throw new InvalidConfigurationException("Failed to parse. Value " + configValue + " must be greater than 0");
            }
            return value;
        };
    }

    /**
     * Non-negative Number
     *
     * @param parser ConfigParameterParser object
     * @param <T>    Type of parameter
     *
     * @return Number which is zero or positive
     */
    static <T extends Number> ConfigParameterParser<T> nonNegative(ConfigParameterParser<T> parser) {
        return configValue -> {
            var value = parser.parse(configValue);
            if (value.longValue() < 0) {
                throw new InvalidConfigurationException("Failed to parse. Negative value " + configValue + " is not supported for this configuration");
            }
            return value;
        };
    }

    /**
     * One value out of a fixed set. The comparison ignores case and the value is returned in its canonical spelling.
     *
     * @param allowed   Canonical spelling of the allowed values
     *
     * @return  The matching allowed value
     */
    static ConfigParameterParser<String> oneOf(String... allowed) {
        return configValue -> {
            for (String value : allowed) {
                if (value.toLowerCase(Locale.ROOT).equals(configValue.trim().toLowerCase(Locale.ROOT))) {
                    return value;
                }
            }

            Set<String> sorted = new TreeSet<>(Arrays.asList(allowed));
            throw new InvalidConfigurationException("Failed to parse. Value " + configValue + " is not one of " + sorted);
        };
    }
}
