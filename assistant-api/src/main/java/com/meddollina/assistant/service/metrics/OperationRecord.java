package com.meddollina.assistant.service.metrics;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Duration;
import java.util.Objects;

/**
 * One line of the performance log describing a single remote operation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"operation", "tokens_used", "latency", "memory_usage_delta", "response_quality_metrics", "intent"})
public record OperationRecord(
        String operation,
        @JsonProperty("tokens_used") long tokensUsed,
        double latency,
        @JsonProperty("memory_usage_delta") Double memoryUsageDelta,
        @JsonProperty("response_quality_metrics") QualityScores responseQualityMetrics,
        String intent
) {

    public static final String RETRIEVAL = "retrieval";
    public static final String VALIDATION = "validation";
    public static final String GENERATION = "generation";
    public static final String REASONING = "chain of thought";

    public OperationRecord {
        Objects.requireNonNull(operation, "operation");
    }

    public static OperationRecord of(String operation, long tokensUsed, Duration latency) {
        double seconds = latency == null ? 0.0 : latency.toNanos() / 1_000_000_000.0;
        return new OperationRecord(operation, tokensUsed, PerformanceRecorder.round(seconds), null, null, null);
    }

    public OperationRecord withMemoryDeltaBytes(long deltaBytes) {
        return new OperationRecord(operation, tokensUsed, latency,
                PerformanceRecorder.round(deltaBytes / 1024.0), responseQualityMetrics, intent);
    }

    public OperationRecord withQuality(QualityScores scores) {
        return new OperationRecord(operation, tokensUsed, latency, memoryUsageDelta,
                scores == null ? null : scores.rounded(), intent);
    }

    public OperationRecord withIntent(String newIntent) {
        return new OperationRecord(operation, tokensUsed, latency, memoryUsageDelta, responseQualityMetrics, newIntent);
    }
}
