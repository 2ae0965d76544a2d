/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator;

import io.kubesim.common.model.StatusUtils;

import java.time.Duration;
import java.time.Instant;

/**
 * Discrete simulated time. Tick 0 is the state before the first reconciliation pass and every tick moves the time
 * forward by a fixed duration.
 */
public class SimulatedClock {
    private final Instant start;
    private final Duration tickDuration;
    private long tick = 0;

    /**
     * Constructs the clock
     *
     * @param start         Simulated time at tick 0
     * @param tickDuration  Duration of one tick
     */
    public SimulatedClock(Instant start, Duration tickDuration) {
        if (tickDuration.isZero() || tickDuration.isNegative()) {
            throw new IllegalArgumentException("Tick duration has to be positive");
        }

        this.start = start;
        this.tickDuration = tickDuration;
    }

    /**
     * Moves to the next tick
     *
     * @return  The new tick
     */
    public long advance() {
        return ++tick;
    }

    /**
     * @return  The current tick
     */
    public long tick() {
        return tick;
    }

    /**
     * @return  Simulated time of the current tick
     */
    public Instant now() {
        return timeOf(tick);
    }

    /**
     * @param tick  Tick
     *
     * @return  Simulated time of the tick
     */
    public Instant timeOf(long tick) {
        return start.plus(tickDuration.multipliedBy(tick));
    }

    /**
     * @return  Simulated time of the current tick formatted as a Kubernetes timestamp
     */
    public String timestamp() {
        return StatusUtils.iso8601(now());
    }

    /**
     * Converts a timestamp written by this clock back to its tick. Timestamps between two ticks belong to the
     * earlier one.
     *
     * @param timestamp     Kubernetes timestamp
     *
     * @return  The tick of the timestamp
     */
    public long tickOf(String timestamp) {
        Duration sinceStart = Duration.between(start, StatusUtils.isoUtcDatetime(timestamp));
        return Math.floorDiv(sinceStart.toMillis(), tickDuration.toMillis());
    }

    /**
     * @return  Duration of one tick
     */
    public Duration tickDuration() {
        return tickDuration;
    }
}
