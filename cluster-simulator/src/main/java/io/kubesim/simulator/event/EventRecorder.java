/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.event;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.kubesim.common.ReconciliationLogger;
import io.kubesim.simulator.SimulatedClock;
import io.kubesim.simulator.model.ResourceKind;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Append-only event log. When the log is full, the oldest events are dropped. Every event is logged as well: Normal
 * events at INFO level and Warning events at WARN level.
 */
public class EventRecorder {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(EventRecorder.class);

    private final SimulatedClock clock;
    private final int capacity;
    private final Deque<Event> events;

    /**
     * Constructs the recorder
     *
     * @param clock     Simulated clock
     * @param capacity  Maximal number of kept events
     */
    public EventRecorder(SimulatedClock clock, int capacity) {
        this.clock = clock;
        this.capacity = capacity;
        this.events = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /**
     * Records a Normal event about a resource
     *
     * @param resource  Involved resource
     * @param reason    Reason
     * @param message   Message
     *
     * @return  The recorded event
     */
    public Event normal(HasMetadata resource, String reason, String message) {
        return record(EventType.Normal, resource, reason, message);
    }

    /**
     * Records a Warning event about a resource
     *
     * @param resource  Involved resource
     * @param reason    Reason
     * @param message   Message
     *
     * @return  The recorded event
     */
    public Event warning(HasMetadata resource, String reason, String message) {
        return record(EventType.Warning, resource, reason, message);
    }

    /**
     * Records an event about a resource
     *
     * @param type      Severity
     * @param resource  Involved resource
     * @param reason    Reason
     * @param message   Message
     *
     * @return  The recorded event
     */
    public Event record(EventType type, HasMetadata resource, String reason, String message) {
        return record(type, ResourceKind.forResource(resource).kind(), resource.getMetadata().getNamespace(), resource.getMetadata().getName(), reason, message);
    }

    /**
     * Records an event
     *
     * @param type      Severity
     * @param kind      Kind of the involved object
     * @param namespace Namespace of the involved object
     * @param name      Name of the involved object
     * @param reason    Reason
     * @param message   Message
     *
     * @return  The recorded event
     */
    public Event record(EventType type, String kind, String namespace, String name, String reason, String message) {
        Event event = new Event(clock.tick(), clock.timestamp(), type, reason, kind, namespace, name, message);

        if (events.size() >= capacity) {
            events.removeFirst();
        }

        events.addLast(event);

        if (type == EventType.Warning) {
            LOGGER.warn("{}", event);
        } else {
            LOGGER.info("{}", event);
        }

        return event;
    }

    /**
     * @return  Snapshot of the event log, oldest first
     */
    public List<Event> events() {
        return List.copyOf(events);
    }

    /**
     * @param reason    Event reason
     *
     * @return  Events with the given reason, oldest first
     */
    public List<Event> events(String reason) {
        return events.stream().filter(event -> event.reason().equals(reason)).toList();
    }
}
