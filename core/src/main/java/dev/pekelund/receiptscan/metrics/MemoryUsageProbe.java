package dev.pekelund.receiptscan.metrics;

/**
 * Source of heap usage figures.
 */
@FunctionalInterface
public interface MemoryUsageProbe {

    MemoryUsageProbe RUNTIME = () -> {
        Runtime runtime = Runtime.getRuntime();
        return new MemoryUsage(runtime.totalMemory() - runtime.freeMemory(), runtime.maxMemory());
    };

    MemoryUsage currentUsage();
}
