package com.phillippitts.granupose.testutil;

import com.phillippitts.granupose.domain.engine.EngineStatus;
import com.phillippitts.granupose.service.engine.EngineStatusChangedEvent;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double for ApplicationEventPublisher that captures events for verification.
 *
 * <p>Thread-safe implementation using CopyOnWriteArrayList for concurrent test scenarios.
 */
public class EventCapturingPublisher implements ApplicationEventPublisher {
    final List<Object> events = new CopyOnWriteArrayList<>();

    @Override
    public void publishEvent(ApplicationEvent event) {
        events.add(event);
    }

    @Override
    public void publishEvent(Object event) {
        events.add(event);
    }

    /**
     * Engine states in publication order, one per status event.
     */
    public List<EngineStatus> engineStatuses() {
        return events.stream()
                .filter(e -> e instanceof EngineStatusChangedEvent)
                .map(e -> ((EngineStatusChangedEvent) e).current().status())
                .toList();
    }

    public List<Object> events() {
        return List.copyOf(events);
    }

    /**
     * Clears all captured events (useful for multi-iteration tests).
     */
    public void clear() {
        events.clear();
    }
}
