/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.common;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.spi.AbstractLogger;
import org.apache.logging.log4j.spi.ExtendedLoggerWrapper;

/**
 * Logger which prefixes every message with the {@link Reconciliation} it belongs to and tags it with the
 * reconciliation marker, so that the output of one controller pass over one resource can be filtered out of the
 * simulation log.
 * <p>
 * Methods without the {@code Cr} suffix log without any reconciliation context and are used for cluster-wide
 * messages (for example the start and end of a tick).
 */
public class ReconciliationLogger {
    private static final String FQCN = ReconciliationLogger.class.getName();

    /**
     * Wrapped logger which we extend
     */
    private final ExtendedLoggerWrapper logger;

    protected ReconciliationLogger(final Logger logger) {
        this.logger = new ExtendedLoggerWrapper((AbstractLogger) logger, logger.getName(), logger.getMessageFactory());
    }

    /**
     * Returns a custom Logger using the fully qualified name of the Class as the Logger name.
     *
     * @param loggerName The Class whose name should be used as the Logger name.
     *
     * @return The custom Logger.
     */
    public static ReconciliationLogger create(final Class<?> loggerName) {
        return new ReconciliationLogger(LogManager.getLogger(loggerName));
    }

    /**
     * Returns a custom Logger with the specified name.
     *
     * @param name The logger name.
     *
     * @return The custom Logger.
     */
    public static ReconciliationLogger create(final String name) {
        return new ReconciliationLogger(LogManager.getLogger(name));
    }

    private void logCr(Level level, Reconciliation reconciliation, String message, Object... params) {
        logger.logIfEnabled(FQCN, level, reconciliation.getMarker(), reconciliation.toString() + ": " + message, params);
    }

    private void logCr(Level level, Reconciliation reconciliation, String message, Throwable t) {
        logger.logIfEnabled(FQCN, level, reconciliation.getMarker(), reconciliation.toString() + ": " + message, t);
    }

    /**
     * Logs a message with parameters at the {@code ERROR} level.
     *
     * @param reconciliation The reconciliation
     * @param message the message to log; the format depends on the message factory.
     * @param params parameters to the message.
     */
    public void errorCr(final Reconciliation reconciliation, final String message, final Object... params) {
        logCr(Level.ERROR, reconciliation, message, params);
    }

    /**
     * Logs a message at the {@code ERROR} level including the stack trace of the {@link Throwable} {@code t}.
     *
     * @param reconciliation The reconciliation
     * @param message the message to log.
     * @param t the exception to log, including its stack trace.
     */
    public void errorCr(final Reconciliation reconciliation, final String message, final Throwable t) {
        logCr(Level.ERROR, reconciliation, message, t);
    }

    /**
     * Logs a message with parameters at the {@code WARN} level.
     *
     * @param reconciliation The reconciliation
     * @param message the message to log; the format depends on the message factory.
     * @param params parameters to the message.
     */
    public void warnCr(final Reconciliation reconciliation, final String message, final Object... params) {
        logCr(Level.WARN, reconciliation, message, params);
    }

    /**
     * Logs a message at the {@code WARN} level including the stack trace of the {@link Throwable} {@code t}.
     *
     * @param reconciliation The reconciliation
     * @param message the message to log.
     * @param t the exception to log, including its stack trace.
     */
    public void warnCr(final Reconciliation reconciliation, final String message, final Throwable t) {
        logCr(Level.WARN, reconciliation, message, t);
    }

    /**
     * Logs a message with parameters at the {@code INFO} level.
     *
     * @param reconciliation The reconciliation
     * @param message the message to log; the format depends on the message factory.
     * @param params parameters to the message.
     */
    public void infoCr(final Reconciliation reconciliation, final String message, final Object... params) {
        logCr(Level.INFO, reconciliation, message, params);
    }

    /**
     * Logs a message with parameters at the {@code DEBUG} level.
     *
     * @param reconciliation The reconciliation
     * @param message the message to log; the format depends on the message factory.
     * @param params parameters to the message.
     */
    public void debugCr(final Reconciliation reconciliation, final String message, final Object... params) {
        logCr(Level.DEBUG, reconciliation, message, params);
    }

    /**
     * Logs a message with parameters at the {@code TRACE} level.
     *
     * @param reconciliation The reconciliation
     * @param message the message to log; the format depends on the message factory.
     * @param params parameters to the message.
     */
    public void traceCr(final Reconciliation reconciliation, final String message, final Object... params) {
        logCr(Level.TRACE, reconciliation, message, params);
    }

    /**
     * Logs a message with parameters at the {@code ERROR} level without reconciliation context.
     *
     * @param message the message to log
     * @param params parameters to the message
     */
    public void error(final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.ERROR, null, message, params);
    }

    /**
     * Logs a message with parameters at the {@code WARN} level without reconciliation context.
     *
     * @param message the message to log
     * @param params parameters to the message
     */
    public void warn(final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.WARN, null, message, params);
    }

    /**
     * Logs a message with parameters at the {@code INFO} level without reconciliation context.
     *
     * @param message the message to log
     * @param params parameters to the message
     */
    public void info(final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.INFO, null, message, params);
    }

    /**
     * Logs a message with parameters at the {@code DEBUG} level without reconciliation context.
     *
     * @param message the message to log
     * @param params parameters to the message
     */
    public void debug(final String message, final Object... params) {
        logger.logIfEnabled(FQCN, Level.DEBUG, null, message, params);
    }

    /**
     * @return  True if debug logging is enabled. False otherwise.
     */
    public boolean isDebugEnabled() {
        return logger.isDebugEnabled();
    }

    /**
     * @return  True if trace logging is enabled. False otherwise.
     */
    public boolean isTraceEnabled() {
        return logger.isTraceEnabled();
    }
}
