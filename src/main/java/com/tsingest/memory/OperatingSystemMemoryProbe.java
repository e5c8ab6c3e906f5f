package com.tsingest.memory;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalLong;

/**
 * Reads physical memory through the JDK's {@code com.sun.management.OperatingSystemMXBean}.
 *
 * <p>On Linux the bean reports {@code MemFree}, which excludes reclaimable page cache, so
 * {@code MemAvailable} from {@code /proc/meminfo} is preferred when readable.
 */
public class OperatingSystemMemoryProbe implements MemoryProbe {

    private static final Path MEMINFO = Path.of("/proc/meminfo");

    private final com.sun.management.OperatingSystemMXBean osBean;

    OperatingSystemMemoryProbe(com.sun.management.OperatingSystemMXBean osBean) {
        this.osBean = osBean;
    }

    /** Whether the running JVM exposes the extended operating system bean. */
    public static boolean isSupported() {
        return ManagementFactory.getOperatingSystemMXBean() instanceof com.sun.management.OperatingSystemMXBean;
    }

    public static OperatingSystemMemoryProbe create() {
        return new OperatingSystemMemoryProbe(
                (com.sun.management.OperatingSystemMXBean) ManagementFactory.getOperatingSystemMXBean());
    }

    @Override
    public MemorySnapshot read() {
        long total = osBean.getTotalMemorySize();
        long available = readMemAvailable().orElse(osBean.getFreeMemorySize());
        return MemorySnapshot.of(total, available);
    }

    private OptionalLong readMemAvailable() {
        if (!Files.isReadable(MEMINFO)) {
            return OptionalLong.empty();
        }
        try {
            List<String> lines = Files.readAllLines(MEMINFO);
            for (String line : lines) {
                if (line.startsWith("MemAvailable:")) {
                    String kb = line.substring("MemAvailable:".length()).replace("kB", "").trim();
                    return OptionalLong.of(Long.parseLong(kb) * 1024L);
                }
            }
        } catch (IOException | NumberFormatException e) {
            return OptionalLong.empty();
        }
        return OptionalLong.empty();
    }
}
