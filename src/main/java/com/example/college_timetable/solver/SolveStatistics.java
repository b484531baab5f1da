package com.example.college_timetable.solver;

import lombok.Value;

@Value
public class SolveStatistics {
    public static final SolveStatistics EMPTY = new SolveStatistics(0, 0, 0, null);

    double wallTimeSeconds;
    long branches;
    long conflicts;
    // null when no objective was optimised
    Double objectiveValue;
}
