package com.phillippitts.anomalyguard;

import com.phillippitts.anomalyguard.config.properties.AlertProperties;
import com.phillippitts.anomalyguard.config.properties.RetrainingProperties;
import com.phillippitts.anomalyguard.config.properties.ScoringProperties;
import com.phillippitts.anomalyguard.config.properties.ThreadPoolProperties;
import com.phillippitts.anomalyguard.config.properties.WindowProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        WindowProperties.class,
        ScoringProperties.class,
        RetrainingProperties.class,
        AlertProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class AnomalyGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnomalyGuardApplication.class, args);
    }

}
