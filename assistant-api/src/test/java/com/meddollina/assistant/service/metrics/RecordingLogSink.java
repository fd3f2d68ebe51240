package com.meddollina.assistant.service.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingLogSink implements PerformanceLogSink {

    private final List<Object> records = new CopyOnWriteArrayList<>();

    public static PerformanceRecorder recorder(RecordingLogSink sink) {
        return new PerformanceRecorder(sink, new ResourceMonitor(), new LexicalResponseQualityEvaluator(), new SimpleMeterRegistry());
    }

    @Override
    public void append(Object record) {
        records.add(record);
    }

    public List<Object> records() {
        return records;
    }

    public List<OperationRecord> operations() {
        return records.stream()
                .filter(OperationRecord.class::isInstance)
                .map(OperationRecord.class::cast)
                .toList();
    }

    public List<OperationRecord> operations(String name) {
        return operations().stream().filter(record -> record.operation().equals(name)).toList();
    }

    public List<PerformanceSummary> summaries() {
        return records.stream()
                .filter(PerformanceSummary.class::isInstance)
                .map(PerformanceSummary.class::cast)
                .toList();
    }
}
