package com.example.college_timetable.solver;

import com.example.college_timetable.enums.SolvePhase;
import com.example.college_timetable.enums.SolveStatus;

/**
 * Notified after each solver phase, e.g. to report the first feasible timetable
 * while the optimisation phase is still running.
 */
@FunctionalInterface
public interface SolveListener {
    SolveListener NONE = (phase, status, statistics) -> { };

    void onPhaseComplete(SolvePhase phase, SolveStatus status, SolveStatistics statistics);
}
