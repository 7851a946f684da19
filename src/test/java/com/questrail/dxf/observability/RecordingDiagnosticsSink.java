package com.questrail.dxf.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingDiagnosticsSink implements DxfDiagnosticsSink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public void onUnhandledGroup(UnhandledGroupEvent event) {
        events.add(event);
    }

    @Override
    public void onWarning(DxfWarningEvent event) {
        events.add(event);
    }

    @Override
    public void onSection(DxfSectionEvent event) {
        events.add(event);
    }

    @Override
    public void onError(DxfErrorEvent event) {
        events.add(event);
    }

    public List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public List<UnhandledGroupEvent> getUnhandledGroups() {
        return ofType(UnhandledGroupEvent.class);
    }

    public List<DxfWarningEvent> getWarnings() {
        return ofType(DxfWarningEvent.class);
    }

    public List<DxfWarningEvent> getWarnings(DxfWarningEvent.Kind kind) {
        return getWarnings().stream()
            .filter(e -> e.kind() == kind)
            .collect(Collectors.toList());
    }

    public List<DxfSectionEvent> getSections() {
        return ofType(DxfSectionEvent.class);
    }

    public List<DxfErrorEvent> getErrors() {
        return ofType(DxfErrorEvent.class);
    }

    private <T> List<T> ofType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}
