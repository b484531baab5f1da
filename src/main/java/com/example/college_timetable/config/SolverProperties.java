package com.example.college_timetable.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.example.college_timetable.solver.EngineSettings;
import com.example.college_timetable.solver.ObjectiveWeights;

import lombok.Getter;
import lombok.Setter;

/**
 * {@code timetable.solver.*} settings from application.yml.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "timetable.solver")
public class SolverProperties {
    // 0 or less means no limit
    private long maxTimeSeconds = 60;
    private int numWorkers = 8;
    private boolean logSearchProgress = false;
    private Integer randomSeed;
    private boolean feasibilityFirst = true;
    private Weights weights = new Weights();

    @Getter
    @Setter
    public static class Weights {
        private int edgePeriodPenalty = 2;
        private int dailyBalancePenalty = 1;
        private int preferenceScale = 1;
        private int sameDayRepeatPenalty = 3;
    }

    public EngineSettings toEngineSettings() {
        return toEngineSettings(maxTimeSeconds > 0 ? Duration.ofSeconds(maxTimeSeconds) : null);
    }

    public EngineSettings toEngineSettings(Duration timeLimit) {
        return EngineSettings.builder()
            .timeLimit(timeLimit)
            .numWorkers(numWorkers)
            .logSearchProgress(logSearchProgress)
            .randomSeed(randomSeed)
            .feasibilityFirst(feasibilityFirst)
            .weights(ObjectiveWeights.builder()
                .edgePeriodPenalty(weights.getEdgePeriodPenalty())
                .dailyBalancePenalty(weights.getDailyBalancePenalty())
                .preferenceScale(weights.getPreferenceScale())
                .sameDayRepeatPenalty(weights.getSameDayRepeatPenalty())
                .build())
            .build();
    }
}
