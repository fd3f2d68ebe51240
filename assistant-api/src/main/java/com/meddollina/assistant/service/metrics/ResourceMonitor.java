package com.meddollina.assistant.service.metrics;

import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process resource figures reported in the performance summary.
 */
@Component
public class ResourceMonitor {

    static final int BYTES_PER_COMPONENT = Double.BYTES;

    private final AtomicLong embeddingBytes = new AtomicLong();
    private final OperatingSystemMXBean operatingSystem = ManagementFactory.getOperatingSystemMXBean();
    private final Runtime runtime = Runtime.getRuntime();

    public double cpuUtilization() {
        if (operatingSystem instanceof com.sun.management.OperatingSystemMXBean extended) {
            double load = extended.getProcessCpuLoad();
            return load < 0 ? 0.0 : load * 100.0;
        }
        return 0.0;
    }

    public long usedMemoryBytes() {
        return runtime.totalMemory() - runtime.freeMemory();
    }

    public double usedMemoryKb() {
        return usedMemoryBytes() / 1024.0;
    }

    public void recordEmbedding(int dimensions) {
        embeddingBytes.addAndGet((long) dimensions * BYTES_PER_COMPONENT);
    }

    public double embeddingSizeKb() {
        return embeddingBytes.get() / 1024.0;
    }

    long embeddingBytes() {
        return embeddingBytes.get();
    }
}
