package com.meddollina.assistant.service.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * Process-wide accumulator of pipeline performance figures. Every pipeline execution
 * writes into the same counters concurrently, so all accumulation goes through adders
 * and concurrent maps. Counters live for the lifetime of the process; a summary only
 * resets the processing-time total.
 */
@Component
public class PerformanceRecorder {

    private static final Logger log = LoggerFactory.getLogger(PerformanceRecorder.class);

    static final String LATENCY_METRIC = "assistant.operation.latency";
    static final String ERROR_METRIC = "assistant.operation.errors";
    static final String INTENT_METRIC = "assistant.intent.usage";

    private final PerformanceLogSink sink;
    private final ResourceMonitor resourceMonitor;
    private final ResponseQualityEvaluator qualityEvaluator;
    private final MeterRegistry meterRegistry;

    private final ConcurrentMap<String, Average> latencies = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LongAdder> sourceUsage = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LongAdder> intentUsage = new ConcurrentHashMap<>();
    private final LongAdder totalTokens = new LongAdder();
    private final LongAdder errorCount = new LongAdder();
    private final AtomicBoolean questionPending = new AtomicBoolean();
    private final DoubleAdder processingTime = new DoubleAdder();
    private final Average readability = new Average();
    private final Average coherence = new Average();
    private final Average hallucination = new Average();
    private final Average redundancy = new Average();

    public PerformanceRecorder(PerformanceLogSink sink,
                               ResourceMonitor resourceMonitor,
                               ResponseQualityEvaluator qualityEvaluator,
                               MeterRegistry meterRegistry) {
        this.sink = sink;
        this.resourceMonitor = resourceMonitor;
        this.qualityEvaluator = qualityEvaluator;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Marks the start of a question. The timestamp line is written ahead of the first
     * operation recorded for it, so questions that log nothing leave no trace.
     */
    public void startQuestion() {
        questionPending.set(true);
    }

    public void record(OperationRecord record) {
        if (questionPending.compareAndSet(true, false)) {
            sink.append(Map.of("timestamp", LocalDateTime.now().toString()));
        }
        totalTokens.add(record.tokensUsed());
        latencies.computeIfAbsent(record.operation(), key -> new Average()).add(record.latency());
        meterRegistry.timer(LATENCY_METRIC, "operation", record.operation())
                .record(Duration.ofNanos((long) (record.latency() * 1_000_000_000L)));

        QualityScores quality = record.responseQualityMetrics();
        if (quality != null) {
            readability.add(quality.readabilityScore());
            coherence.add(quality.coherenceScore());
            hallucination.add(quality.hallucinationRate());
            redundancy.add(quality.redundancyRate());
        }
        if (record.intent() != null) {
            intentUsage.computeIfAbsent(record.intent(), key -> new LongAdder()).increment();
            meterRegistry.counter(INTENT_METRIC, "intent", record.intent()).increment();
        }
        sink.append(record);
    }

    public void recordError(String operation) {
        errorCount.increment();
        meterRegistry.counter(ERROR_METRIC, "operation", operation).increment();
    }

    public void recordSources(List<String> sources) {
        for (String source : sources) {
            sourceUsage.computeIfAbsent(source, key -> new LongAdder()).increment();
        }
    }

    public void recordProcessingTime(Duration elapsed) {
        processingTime.add(elapsed.toNanos() / 1_000_000_000.0);
    }

    /**
     * Quality figures are only meaningful when all three texts are present.
     */
    public Optional<QualityScores> assessQuality(String question, String context, String response) {
        if (isBlank(question) || isBlank(context) || isBlank(response)) {
            log.debug("Skipping quality assessment, question, context or response is empty");
            return Optional.empty();
        }
        try {
            return Optional.of(qualityEvaluator.evaluate(question, context, response));
        } catch (RuntimeException ex) {
            log.warn("Quality assessment failed: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    public PerformanceSummary emitSummary() {
        PerformanceSummary summary = new PerformanceSummary(
                new PerformanceSummary.Totals(
                        round(averageOf(OperationRecord.RETRIEVAL)),
                        round(averageOf(OperationRecord.VALIDATION)),
                        round(averageOf(OperationRecord.GENERATION)),
                        totalTokens.sum(),
                        round(processingTime.sumThenReset()),
                        errorCount.sum(),
                        new PerformanceSummary.QualityAverages(
                                round(readability.value()),
                                round(coherence.value()),
                                round(hallucination.value()),
                                round(redundancy.value()))),
                new PerformanceSummary.ResourceUsage(
                        round(resourceMonitor.cpuUtilization()),
                        round(resourceMonitor.usedMemoryKb()),
                        round(resourceMonitor.embeddingSizeKb())),
                snapshot(sourceUsage),
                snapshot(intentUsage));
        sink.append(summary);
        return summary;
    }

    public ResourceMonitor resources() {
        return resourceMonitor;
    }

    private double averageOf(String operation) {
        Average average = latencies.get(operation);
        return average == null ? 0.0 : average.value();
    }

    private static Map<String, Long> snapshot(Map<String, LongAdder> counters) {
        Map<String, Long> copy = new TreeMap<>();
        counters.forEach((key, adder) -> copy.put(key, adder.sum()));
        return copy;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static final class Average {
        private final DoubleAdder sum = new DoubleAdder();
        private final LongAdder count = new LongAdder();

        void add(double value) {
            sum.add(value);
            count.increment();
        }

        double value() {
            long samples = count.sum();
            return samples == 0 ? 0.0 : sum.sum() / samples;
        }
    }
}
