/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.event;

import io.kubesim.simulator.ResourceUtils;
import io.kubesim.simulator.SimulatedClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

public class EventRecorderTest {
    private final SimulatedClock clock = new SimulatedClock(Instant.parse("2024-01-01T00:00:00Z"), Duration.ofMinutes(1));

    @Test
    public void testRecord() {
        EventRecorder recorder = new EventRecorder(clock, 10);
        clock.advance();

        Event event = recorder.warning(ResourceUtils.pod("web-1", "web"), "BackOff", "Back-off restarting failed container");

        assertThat(event.tick(), is(1L));
        assertThat(event.timestamp(), is("2024-01-01T00:01:00Z"));
        assertThat(event.type(), is(EventType.Warning));
        assertThat(event.kind(), is("Pod"));
        assertThat(event.namespace(), is("default"));
        assertThat(event.name(), is("web-1"));
        assertThat(event.toString(), is("[1] Warning BackOff Pod/default/web-1: Back-off restarting failed container"));
        assertThat(recorder.events(), contains(event));
    }

    @Test
    public void testCapacityDropsOldestEvents() {
        EventRecorder recorder = new EventRecorder(clock, 3);

        for (int i = 0; i < 5; i++) {
            recorder.record(EventType.Normal, "Node", null, "node-" + i, "NodeReady", "Node node-" + i + " status is now: NodeReady");
        }

        List<Event> events = recorder.events();
        assertThat(events.stream().map(Event::name).toList(), contains("node-2", "node-3", "node-4"));
    }

    @Test
    public void testFilterByReason() {
        EventRecorder recorder = new EventRecorder(clock, 10);

        recorder.normal(ResourceUtils.pod("a", "web"), "Scheduled", "Successfully assigned default/a to node-1");
        recorder.warning(ResourceUtils.pod("b", "web"), "FailedScheduling", "no nodes available to schedule pods");
        recorder.normal(ResourceUtils.pod("c", "web"), "Scheduled", "Successfully assigned default/c to node-1");

        assertThat(recorder.events("Scheduled").stream().map(Event::name).toList(), contains("a", "c"));
        assertThat(recorder.events("Unknown").isEmpty(), is(true));
    }
}
