package com.meddollina.assistant.service.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

public record QualityScores(
        @JsonProperty("readability_score") double readabilityScore,
        @JsonProperty("coherence_score") double coherenceScore,
        @JsonProperty("hallucination_rate") double hallucinationRate,
        @JsonProperty("redundancy_rate") double redundancyRate
) {

    public QualityScores rounded() {
        return new QualityScores(
                PerformanceRecorder.round(readabilityScore),
                PerformanceRecorder.round(coherenceScore),
                PerformanceRecorder.round(hallucinationRate),
                PerformanceRecorder.round(redundancyRate));
    }
}
