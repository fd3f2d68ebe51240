package com.meddollina.assistant.service.metrics;

/**
 * Destination for performance log records; each record becomes one JSON line.
 */
public interface PerformanceLogSink {

    void append(Object record);
}
