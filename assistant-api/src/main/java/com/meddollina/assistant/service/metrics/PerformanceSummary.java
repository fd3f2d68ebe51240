package com.meddollina.assistant.service.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

@JsonPropertyOrder({"Performance Summary", "Memory Usage", "Source Usage", "Intent Usage"})
public record PerformanceSummary(
        @JsonProperty("Performance Summary") Totals performance,
        @JsonProperty("Memory Usage") ResourceUsage memoryUsage,
        @JsonProperty("Source Usage") Map<String, Long> sourceUsage,
        @JsonProperty("Intent Usage") Map<String, Long> intentUsage
) {

    public PerformanceSummary {
        sourceUsage = Map.copyOf(sourceUsage);
        intentUsage = Map.copyOf(intentUsage);
    }

    @JsonPropertyOrder({"average_retrieval_time", "average_validation_time", "average_generation_time",
            "total_tokens_processed", "total_processing_time", "error_count", "average_response_quality_metrics"})
    public record Totals(
            @JsonProperty("average_retrieval_time") double averageRetrievalTime,
            @JsonProperty("average_validation_time") double averageValidationTime,
            @JsonProperty("average_generation_time") double averageGenerationTime,
            @JsonProperty("total_tokens_processed") long totalTokensProcessed,
            @JsonProperty("total_processing_time") double totalProcessingTime,
            @JsonProperty("error_count") long errorCount,
            @JsonProperty("average_response_quality_metrics") QualityAverages averageResponseQualityMetrics
    ) {
    }

    public record QualityAverages(
            @JsonProperty("average_readability_score") double averageReadabilityScore,
            @JsonProperty("average_coherence_score") double averageCoherenceScore,
            @JsonProperty("average_hallucination_rate") double averageHallucinationRate,
            @JsonProperty("average_redundancy_rate") double averageRedundancyRate
    ) {
    }

    public record ResourceUsage(
            @JsonProperty("cpu_utilization") double cpuUtilization,
            @JsonProperty("memory_usage") double memoryUsage,
            @JsonProperty("embedding_size") double embeddingSize
    ) {
    }
}
