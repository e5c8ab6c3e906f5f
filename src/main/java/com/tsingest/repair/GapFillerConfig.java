package com.tsingest.repair;

import com.tsingest.gaps.GapAnalyzer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers {@link PassThroughGapFiller} unless the application provides its own {@link GapFiller}.
 */
@Configuration
public class GapFillerConfig {

    @Bean
    @ConditionalOnMissingBean(GapFiller.class)
    public GapFiller gapFiller(GapAnalyzer gapAnalyzer) {
        return new PassThroughGapFiller(gapAnalyzer);
    }
}
