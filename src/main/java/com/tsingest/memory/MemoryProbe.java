package com.tsingest.memory;

/**
 * Platform-specific source of memory readings. Implementations may throw; the
 * {@link MemoryGovernor} turns any failure into an optimistic snapshot.
 */
@FunctionalInterface
public interface MemoryProbe {

    MemorySnapshot read();
}
