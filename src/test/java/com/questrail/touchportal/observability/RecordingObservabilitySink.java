package com.questrail.touchportal.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements PluginObservabilitySink {
    private final List<Object> events = new ArrayList<>();
    private final List<String> inbound = new ArrayList<>();
    private final List<String> outbound = new ArrayList<>();

    @Override
    public synchronized void onConnectionTransition(ConnectionTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onInbound(String line) {
        inbound.add(line);
    }

    @Override
    public synchronized void onOutbound(String line) {
        outbound.add(line);
    }

    @Override
    public synchronized void onError(PluginErrorEvent event) {
        events.add(event);
    }

    public synchronized List<ConnectionTransitionEvent> getTransitions() {
        return events.stream()
            .filter(e -> e instanceof ConnectionTransitionEvent)
            .map(e -> (ConnectionTransitionEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<PluginErrorEvent> getErrors() {
        return events.stream()
            .filter(e -> e instanceof PluginErrorEvent)
            .map(e -> (PluginErrorEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<PluginErrorEvent> getErrors(ErrorCategory category) {
        return getErrors().stream()
            .filter(e -> e.category() == category)
            .collect(Collectors.toList());
    }

    public synchronized List<String> getInbound() {
        return new ArrayList<>(inbound);
    }

    public synchronized List<String> getOutbound() {
        return new ArrayList<>(outbound);
    }
}
