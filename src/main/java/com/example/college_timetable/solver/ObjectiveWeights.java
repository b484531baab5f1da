package com.example.college_timetable.solver;

import lombok.Builder;
import lombok.Value;

/**
 * Relative weights of the soft terms in the objective. A weight of zero drops
 * the term from the model.
 */
@Value
@Builder(toBuilder = true)
public class ObjectiveWeights {
    @Builder.Default
    long edgePeriodPenalty = 2;

    @Builder.Default
    long dailyBalancePenalty = 1;

    // multiplies the admin-entered preference weights
    @Builder.Default
    long preferenceScale = 1;

    @Builder.Default
    long sameDayRepeatPenalty = 3;

    public static ObjectiveWeights defaults() {
        return ObjectiveWeights.builder().build();
    }

    public static ObjectiveWeights none() {
        return ObjectiveWeights.builder()
            .edgePeriodPenalty(0)
            .dailyBalancePenalty(0)
            .preferenceScale(0)
            .sameDayRepeatPenalty(0)
            .build();
    }
}
