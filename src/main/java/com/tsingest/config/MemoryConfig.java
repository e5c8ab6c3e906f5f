package com.tsingest.config;

import com.tsingest.memory.JvmHeapMemoryProbe;
import com.tsingest.memory.MemoryProbe;
import com.tsingest.memory.MostConstrainedMemoryProbe;
import com.tsingest.memory.OperatingSystemMemoryProbe;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Picks the memory probes once at startup based on what the JVM supports.
 *
 * <p>The JVM heap is always probed, since a Java process runs out of heap before it runs out
 * of physical memory in most deployments. Physical memory is added when the extended
 * operating system bean is present; the governor then sees the tighter of the two.
 */
@Configuration
public class MemoryConfig {

    private static final Logger log = LoggerFactory.getLogger(MemoryConfig.class);

    @Bean
    public MemoryProbe memoryProbe() {
        List<MemoryProbe> probes = new ArrayList<>();
        probes.add(new JvmHeapMemoryProbe());
        if (OperatingSystemMemoryProbe.isSupported()) {
            probes.add(OperatingSystemMemoryProbe.create());
        } else {
            log.info("Operating system memory bean not available, governing on JVM heap only");
        }
        return new MostConstrainedMemoryProbe(probes);
    }
}
