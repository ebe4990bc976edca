package io.aggregator.diagnostics;

import java.util.ArrayList;
import java.util.List;

public class CollectingDiagnosticSink implements DiagnosticSink {
    private final List<DiagnosticEvent> events = new ArrayList<>();

    @Override
    public synchronized void accept(DiagnosticEvent event) {
        events.add(event);
    }

    public synchronized List<DiagnosticEvent> events() {
        return List.copyOf(events);
    }

    /** Row-level warnings only, i.e. the skipped rows. */
    public synchronized List<DiagnosticEvent> skipped() {
        return events.stream().filter(DiagnosticEvent::hasRow).toList();
    }

    public synchronized void clear() { events.clear(); }
}
