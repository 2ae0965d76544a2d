/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.common.config;

import io.kubesim.common.InvalidConfigurationException;

import java.util.HashMap;
import java.util.Map;

/**
 * Models a configuration parameter, identified by a unique key, which may be required, and if not may have a default value.
 * Optional parameters without a default value implicitly have a null default.
 * The key is also the name of the environment variable from which the value may be read, when it is read from the environment.
 *
 * @param key           Configuration parameter name/key
 * @param <T>           Type of object
 * @param type          Parser of the value
 * @param defaultValue  Default value of the configuration parameter
 * @param required      If the value is required or not
 * @param map           Map that will contain all the configuration values
 */
public record ConfigParameter<T>(String key, ConfigParameterParser<T> type, String defaultValue, boolean required, Map<String, ConfigParameter<?>> map) {
    /**
     * Constructor of a required parameter
     *
     * @param key           Configuration parameter name/key
     * @param type          Parser of the value
     * @param map           Configuration map
     */
    public ConfigParameter(String key, ConfigParameterParser<T> type, Map<String, ConfigParameter<?>> map) {
        this(key, type, null, true, map);
        map.put(key(), this);
    }

    /**
     * Constructor of an optional parameter
     *
     * @param key           Configuration parameter name/key
     * @param type          Parser of the value
     * @param defaultValue  Default value of the configuration parameter
     * @param map           Configuration map
     */
    public ConfigParameter(String key, ConfigParameterParser<T> type, String defaultValue, Map<String, ConfigParameter<?>> map) {
        this(key, type, defaultValue, false, map);
        map.put(key(), this);
    }

    /**
     * Generates the configuration map
     *
     * @param userValues            Map containing values entered by user.
     * @param configParameterMap    Map containing all the configuration keys with default values
     *
     * @return  Generated configuration map
     */
    public static Map<String, Object> define(Map<String, String> userValues, Map<String, ConfigParameter<?>> configParameterMap) {
        Map<String, Object> generatedMap = new HashMap<>(configParameterMap.size());

        for (Map.Entry<String, String> entry : userValues.entrySet()) {
            if (!configParameterMap.containsKey(entry.getKey())) {
                throw new InvalidConfigurationException("Unknown configuration parameter " + entry.getKey());
            }
        }

        for (ConfigParameter<?> parameter : configParameterMap.values()) {
            String value = userValues.get(parameter.key());

            // Null or empty values fall back to the default
            if (value == null || value.isEmpty()) {
                value = parameter.defaultValue();
            }

            generatedMap.put(parameter.key(), parse(parameter, value));
        }

        return generatedMap;
    }

    private static <T> T parse(ConfigParameter<T> parameter, String value) {
        if (value != null) {
            return parameter.type().parse(value);
        } else if (parameter.required()) {
            throw new InvalidConfigurationException("Config value: " + parameter.key() + " is mandatory");
        } else {
            return null;
        }
    }
}
