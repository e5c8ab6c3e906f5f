package com.tsingest.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Micrometer metrics configuration.
 *
 * <p>Supplies an in-memory {@link SimpleMeterRegistry} unless the embedding application
 * registers its own, and applies the {@code application} common tag to every meter. The
 * metric definitions live in {@link com.tsingest.observability.IngestionMetricsService}.
 */
@Configuration
public class MetricsConfig {

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        MeterRegistry registry = new SimpleMeterRegistry();
        registry.config().commonTags("application", "tsingest");
        return registry;
    }
}
