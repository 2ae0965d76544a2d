/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.common.model;

/**
 * Exception thrown when a resource submitted to the cluster is invalid or conflicts with the existing state. The
 * resource is rejected before it enters the object store.
 */
public class InvalidResourceException extends RuntimeException {
    /**
     * Constructor
     *
     * @param s Message describing the issue
     */
    public InvalidResourceException(String s) {
        super(s);
    }

    /**
     * Constructor
     *
     * @param message   Message describing the issue
     * @param cause     Cause of the issue
     */
    public InvalidResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
