package com.questrail.osc.observability;

import com.questrail.osc.OscErrorCode;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test handler that records error events for assertions.
 */
public final class RecordingErrorHandler implements OscErrorHandler {
    private final List<OscErrorEvent> events = new ArrayList<>();

    @Override
    public synchronized void onError(OscErrorEvent event) {
        events.add(event);
    }

    public synchronized List<OscErrorEvent> events() {
        return new ArrayList<>(events);
    }

    public synchronized List<OscErrorCode> codes() {
        return events.stream().map(OscErrorEvent::code).collect(Collectors.toList());
    }

    public synchronized boolean isEmpty() {
        return events.isEmpty();
    }

    public synchronized void clear() {
        events.clear();
    }
}
