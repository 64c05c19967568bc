package com.companyintel.research.progress;

import com.companyintel.research.model.ProviderCallRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingProgressSink implements ProgressSink {
    private final ProgressSink delegate;
    private final List<ProgressEvent> events = new CopyOnWriteArrayList<>();

    public RecordingProgressSink() {
        this(ProgressSink.noop());
    }

    public RecordingProgressSink(ProgressSink delegate) {
        this.delegate = delegate == null ? ProgressSink.noop() : delegate;
    }

    @Override
    public void onEvent(ProgressEvent event) {
        events.add(event);
        delegate.onEvent(event);
    }

    public List<ProgressEvent> events() {
        return List.copyOf(events);
    }

    public List<ProgressEvent> eventsForStage(String stage) {
        return events.stream().filter(event -> Objects.equals(stage, event.stage())).toList();
    }

    public List<ProviderCallRecord> providerCalls() {
        List<ProviderCallRecord> calls = new ArrayList<>();
        for (ProgressEvent event : events) {
            if (event.providerCall() != null) {
                calls.add(event.providerCall());
            }
        }
        return calls;
    }
}
