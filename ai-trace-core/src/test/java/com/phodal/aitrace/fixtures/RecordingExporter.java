package com.phodal.aitrace.fixtures;

import com.phodal.aitrace.exporter.TracingExporter;
import com.phodal.aitrace.model.AiTracingEvent;
import com.phodal.aitrace.model.ExportedSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Keeps every event it receives.
 */
public class RecordingExporter implements TracingExporter {
    private final List<AiTracingEvent> events = new ArrayList<>();
    private int shutdownCount;

    @Override
    public synchronized void exportEvent(AiTracingEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void shutdown() {
        shutdownCount++;
    }

    @Override
    public String getName() {
        return "recording";
    }

    public synchronized List<AiTracingEvent> getEvents() {
        return List.copyOf(events);
    }

    public synchronized List<ExportedSpan> endedSpans() {
        return events.stream()
                .filter(e -> e.type() == AiTracingEvent.Type.SPAN_ENDED)
                .map(AiTracingEvent::exportedSpan)
                .toList();
    }

    /**
     * The last snapshot of the ended span with the given name.
     */
    public synchronized ExportedSpan endedSpan(String name) {
        List<ExportedSpan> matches = new ArrayList<>();
        for (ExportedSpan span : endedSpans()) {
            if (Objects.equals(span.name(), name)) {
                matches.add(span);
            }
        }
        if (matches.isEmpty()) {
            throw new AssertionError("No ended span named " + name + " in " + events);
        }
        return matches.get(matches.size() - 1);
    }

    public synchronized int getShutdownCount() {
        return shutdownCount;
    }
}
