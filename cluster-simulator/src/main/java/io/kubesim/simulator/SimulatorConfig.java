/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator;

import io.kubesim.common.config.ConfigParameter;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static io.kubesim.common.config.ConfigParameterParser.INSTANT;
import static io.kubesim.common.config.ConfigParameterParser.INTEGER;
import static io.kubesim.common.config.ConfigParameterParser.LONG;
import static io.kubesim.common.config.ConfigParameterParser.nonNegative;
import static io.kubesim.common.config.ConfigParameterParser.oneOf;
import static io.kubesim.common.config.ConfigParameterParser.strictlyPositive;

/**
 * Simulator configuration
 */
public class SimulatorConfig {
    private static final Map<String, ConfigParameter<?>> CONFIG_VALUES = new HashMap<>();

    /**
     * Ticks a scheduled pod needs before it is Running
     */
    public static final ConfigParameter<Integer> POD_STARTUP_TICKS = new ConfigParameter<>("KUBESIM_POD_STARTUP_TICKS", strictlyPositive(INTEGER), "1", CONFIG_VALUES);
    /**
     * Ticks a tombstoned pod stays in the store before it is removed
     */
    public static final ConfigParameter<Integer> TERMINATION_GRACE_TICKS = new ConfigParameter<>("KUBESIM_TERMINATION_GRACE_TICKS", nonNegative(INTEGER), "1", CONFIG_VALUES);
    /**
     * Minimal number of ticks between two rescales done by one autoscaler
     */
    public static final ConfigParameter<Integer> HPA_STABILIZATION_TICKS = new ConfigParameter<>("KUBESIM_HPA_STABILIZATION_TICKS", strictlyPositive(INTEGER), "3", CONFIG_VALUES);
    /**
     * Default number of ticks a Job pod runs before it completes
     */
    public static final ConfigParameter<Integer> JOB_COMPLETION_TICKS = new ConfigParameter<>("KUBESIM_JOB_COMPLETION_TICKS", strictlyPositive(INTEGER), "2", CONFIG_VALUES);
    /**
     * Maximal number of events kept in the event log
     */
    public static final ConfigParameter<Integer> EVENT_LOG_CAPACITY = new ConfigParameter<>("KUBESIM_EVENT_LOG_CAPACITY", strictlyPositive(INTEGER), "1000", CONFIG_VALUES);
    /**
     * Pod capacity of nodes which do not declare one
     */
    public static final ConfigParameter<Integer> DEFAULT_NODE_CAPACITY = new ConfigParameter<>("KUBESIM_DEFAULT_NODE_CAPACITY", strictlyPositive(INTEGER), "110", CONFIG_VALUES);
    /**
     * Simulated time at tick 0
     */
    public static final ConfigParameter<Instant> START_TIME = new ConfigParameter<>("KUBESIM_START_TIME", INSTANT, "2024-01-01T00:00:00Z", CONFIG_VALUES);
    /**
     * Simulated seconds per tick
     */
    public static final ConfigParameter<Long> TICK_DURATION_SECONDS = new ConfigParameter<>("KUBESIM_TICK_DURATION_SECONDS", strictlyPositive(LONG), "60", CONFIG_VALUES);
    /**
     * Seed of the generator of names and UIDs
     */
    public static final ConfigParameter<Long> RANDOM_SEED = new ConfigParameter<>("KUBESIM_RANDOM_SEED", LONG, "0", CONFIG_VALUES);
    /**
     * Node selection strategy used by the scheduler
     */
    public static final ConfigParameter<String> SCHEDULING_STRATEGY = new ConfigParameter<>("KUBESIM_SCHEDULING_STRATEGY", oneOf("FirstFit", "LeastAllocated"), "FirstFit", CONFIG_VALUES);
    /**
     * Ticks without progress after which a rollout is reported as stalled, used when the Deployment does not set
     * progressDeadlineSeconds
     */
    public static final ConfigParameter<Integer> ROLLOUT_PROGRESS_DEADLINE_TICKS = new ConfigParameter<>("KUBESIM_ROLLOUT_PROGRESS_DEADLINE_TICKS", strictlyPositive(INTEGER), "10", CONFIG_VALUES);

    private final Map<String, Object> map;

    /**
     * Constructor
     *
     * @param map Map containing configurations and their respective values
     */
    private SimulatorConfig(Map<String, Object> map) {
        this.map = map;
    }

    /**
     * Creates the simulator configuration from a map. Keys which are not simulator options are ignored, so the
     * process environment can be passed in directly.
     *
     * @param map   Map with configuration values
     *
     * @return  Simulator configuration
     */
    public static SimulatorConfig buildFromMap(Map<String, String> map) {
        Map<String, String> envMap = new HashMap<>(map);
        envMap.keySet().retainAll(SimulatorConfig.keyNames());

        Map<String, Object> generatedMap = ConfigParameter.define(envMap, CONFIG_VALUES);

        return new SimulatorConfig(generatedMap);
    }

    /**
     * @return  Configuration with all values set to their defaults
     */
    public static SimulatorConfig defaultConfig() {
        return buildFromMap(Map.of());
    }

    /**
     * @return Set of configuration key/names
     */
    public static Set<String> keyNames() {
        return Collections.unmodifiableSet(CONFIG_VALUES.keySet());
    }

    /**
     * Gets the configuration value corresponding to the key
     * @param <T>      Type of value
     * @param value    Instance of Config Parameter class
     * @return         Configuration value w.r.t to the key
     */
    @SuppressWarnings("unchecked")
    public <T> T get(ConfigParameter<T> value) {
        return (T) this.map.get(value.key());
    }

    /**
     * @return  Ticks a scheduled pod needs before it is Running
     */
    public int getPodStartupTicks() {
        return get(POD_STARTUP_TICKS);
    }

    /**
     * @return  Ticks a tombstoned pod stays in the store
     */
    public int getTerminationGraceTicks() {
        return get(TERMINATION_GRACE_TICKS);
    }

    /**
     * @return  Minimal ticks between two rescales of one autoscaler
     */
    public int getHpaStabilizationTicks() {
        return get(HPA_STABILIZATION_TICKS);
    }

    /**
     * @return  Default Job pod run time in ticks
     */
    public int getJobCompletionTicks() {
        return get(JOB_COMPLETION_TICKS);
    }

    /**
     * @return  Capacity of the event log
     */
    public int getEventLogCapacity() {
        return get(EVENT_LOG_CAPACITY);
    }

    /**
     * @return  Default node pod capacity
     */
    public int getDefaultNodeCapacity() {
        return get(DEFAULT_NODE_CAPACITY);
    }

    /**
     * @return  Simulated time at tick 0
     */
    public Instant getStartTime() {
        return get(START_TIME);
    }

    /**
     * @return  Simulated duration of one tick
     */
    public Duration getTickDuration() {
        return Duration.ofSeconds(get(TICK_DURATION_SECONDS));
    }

    /**
     * @return  Seed for names and UIDs
     */
    public long getRandomSeed() {
        return get(RANDOM_SEED);
    }

    /**
     * @return  Name of the scheduling strategy
     */
    public String getSchedulingStrategy() {
        return get(SCHEDULING_STRATEGY);
    }

    /**
     * @return  Default rollout progress deadline in ticks
     */
    public int getRolloutProgressDeadlineTicks() {
        return get(ROLLOUT_PROGRESS_DEADLINE_TICKS);
    }

    @Override
    public String toString() {
        return "SimulatorConfig(" +
                "podStartupTicks=" + getPodStartupTicks() +
                ",terminationGraceTicks=" + getTerminationGraceTicks() +
                ",hpaStabilizationTicks=" + getHpaStabilizationTicks() +
                ",jobCompletionTicks=" + getJobCompletionTicks() +
                ",eventLogCapacity=" + getEventLogCapacity() +
                ",defaultNodeCapacity=" + getDefaultNodeCapacity() +
                ",startTime=" + getStartTime() +
                ",tickDuration=" + getTickDuration() +
                ",randomSeed=" + getRandomSeed() +
                ",schedulingStrategy=" + getSchedulingStrategy() +
                ",rolloutProgressDeadlineTicks=" + getRolloutProgressDeadlineTicks() +
                ")";
    }
}
