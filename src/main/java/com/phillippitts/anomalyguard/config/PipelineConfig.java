package com.phillippitts.anomalyguard.config;

import com.phillippitts.anomalyguard.config.properties.RetrainingProperties;
import com.phillippitts.anomalyguard.config.properties.ScoringProperties;
import com.phillippitts.anomalyguard.service.scoring.GaussianZScoreAlgorithm;
import com.phillippitts.anomalyguard.service.scoring.RobustZScoreAlgorithm;
import com.phillippitts.anomalyguard.service.scoring.ScoringAlgorithm;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ScoringAlgorithm scoringAlgorithm(ScoringProperties scoring, RetrainingProperties retraining) {
        return switch (scoring.getAlgorithm()) {
            case ROBUST_ZSCORE -> new RobustZScoreAlgorithm(retraining.getBatchSize());
            case GAUSSIAN -> new GaussianZScoreAlgorithm(retraining.getBatchSize());
        };
    }
}
