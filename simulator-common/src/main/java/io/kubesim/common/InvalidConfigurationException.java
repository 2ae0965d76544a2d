/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.common;

/**
 * Represents an exception raised when an invalid configuration is passed when the simulator is created
 */
public class InvalidConfigurationException extends RuntimeException {
    /**
     * Constructor
     *
     * @param message   Message describing the issue
     */
    public InvalidConfigurationException(String message) {
        super(message);
    }

    /**
     * Constructor
     *
     * @param message   Message describing the issue
     * @param t         Cause of the issue
     */
    public InvalidConfigurationException(String message, Throwable t) {
        super(message, t);
    }
}
