package com.tsingest.memory;

import java.util.List;

/**
 * Reports the reading with the least available memory among its delegates. Delegates that
 * fail are skipped; if all fail the failure propagates to the governor.
 */
public class MostConstrainedMemoryProbe implements MemoryProbe {

    private final List<MemoryProbe> delegates;

    public MostConstrainedMemoryProbe(List<MemoryProbe> delegates) {
        if (delegates.isEmpty()) {
            throw new IllegalArgumentException("At least one memory probe is required");
        }
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public MemorySnapshot read() {
        MemorySnapshot lowest = null;
        RuntimeException lastFailure = null;
        for (MemoryProbe delegate : delegates) {
            try {
                MemorySnapshot snapshot = delegate.read();
                if (lowest == null || snapshot.availableBytes() < lowest.availableBytes()) {
                    lowest = snapshot;
                }
            } catch (RuntimeException e) {
                lastFailure = e;
            }
        }
        if (lowest == null) {
            throw lastFailure;
        }
        return lowest;
    }
}
