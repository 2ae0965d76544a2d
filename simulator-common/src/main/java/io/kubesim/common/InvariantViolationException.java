/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.common;

/**
 * Thrown when the cluster state breaks a rule which correct controllers never break (for example two live pods
 * claiming the same StatefulSet ordinal). It is a programming error: the current tick is aborted and the exception is
 * propagated to whoever called the tick.
 */
public class InvariantViolationException extends RuntimeException {
    /**
     * Constructor
     *
     * @param message   Message describing the violated invariant
     */
    public InvariantViolationException(String message) {
        super(message);
    }
}
