package com.tsingest.memory;

/**
 * Heap headroom of the running JVM: what can still be allocated before {@code -Xmx} is reached.
 */
public class JvmHeapMemoryProbe implements MemoryProbe {

    private final Runtime runtime;

    public JvmHeapMemoryProbe() {
        this(Runtime.getRuntime());
    }

    JvmHeapMemoryProbe(Runtime runtime) {
        this.runtime = runtime;
    }

    @Override
    public MemorySnapshot read() {
        long max = runtime.maxMemory();
        long used = runtime.totalMemory() - runtime.freeMemory();
        return MemorySnapshot.of(max, Math.max(0, max - used));
    }
}
