package dev.pekelund.receiptscan.metrics;

/**
 * Heap usage in bytes.
 */
public record MemoryUsage(long usedBytes, long maxBytes) {

    /**
     * @return used heap as a fraction of the maximum, or 0 when the maximum is unknown
     */
    public double usedRatio() {
        return maxBytes > 0 ? (double) usedBytes / maxBytes : 0.0;
    }

    public long usedMegabytes() {
        return usedBytes / (1024 * 1024);
    }
}
