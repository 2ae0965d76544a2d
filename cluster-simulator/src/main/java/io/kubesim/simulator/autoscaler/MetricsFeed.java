/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.autoscaler;

import io.kubesim.common.model.InvalidResourceException;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Externally supplied CPU utilization samples, keyed by pod UID. A new sample replaces the previous one.
 */
public class MetricsFeed {
    private final Map<String, Integer> samples = new HashMap<>();

    /**
     * Records a sample
     *
     * @param podUid    UID of the pod
     * @param percent   CPU utilization in percent of the requested CPU
     */
    public void report(String podUid, int percent) {
        if (percent < 0) {
            throw new InvalidResourceException("CPU utilization cannot be negative: " + percent);
        }

        samples.put(podUid, percent);
    }

    /**
     * @param podUid    UID of the pod
     *
     * @return  The last sample of the pod or null if there is none
     */
    public Integer sample(String podUid) {
        return samples.get(podUid);
    }

    /**
     * Drops the samples of pods which no longer exist
     *
     * @param podUids   UIDs of the existing pods
     */
    public void retainAll(Set<String> podUids) {
        samples.keySet().retainAll(podUids);
    }

    /**
     * @return  Number of kept samples
     */
    public int size() {
        return samples.size();
    }
}
