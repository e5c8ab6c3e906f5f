package com.tsingest.memory;

/**
 * Point-in-time memory reading. {@code known == false} marks the optimistic fallback used when
 * the platform could not be queried.
 */
public record MemorySnapshot(long totalBytes, long availableBytes, long usedBytes, double percentUsed, boolean known) {

    public static MemorySnapshot of(long totalBytes, long availableBytes) {
        long used = Math.max(0, totalBytes - availableBytes);
        double percent = totalBytes > 0 ? (used * 100.0) / totalBytes : 0.0;
        return new MemorySnapshot(totalBytes, availableBytes, used, percent, true);
    }

    public static MemorySnapshot unknown() {
        return new MemorySnapshot(0, Long.MAX_VALUE, 0, 0.0, false);
    }

    public long availableMb() {
        return availableBytes / (1024 * 1024);
    }
}
