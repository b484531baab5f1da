package com.example.college_timetable.solver;

import java.time.Duration;

import lombok.Builder;
import lombok.Value;

/**
 * Everything a generation run is configured with besides the catalog itself.
 */
@Value
@Builder(toBuilder = true)
public class EngineSettings {
    // null means no limit
    Duration timeLimit;

    @Builder.Default
    int numWorkers = 8;

    @Builder.Default
    boolean logSearchProgress = false;

    @Builder.Default
    boolean feasibilityFirst = true;

    Integer randomSeed;

    @Builder.Default
    ObjectiveWeights weights = ObjectiveWeights.defaults();

    public static EngineSettings defaults() {
        return EngineSettings.builder().build();
    }
}
