package com.example.college_timetable.solver;

import com.example.college_timetable.enums.SolveStatus;

import lombok.Value;

/**
 * Terminal state of a solve. OPTIMAL and FEASIBLE always carry an assignment;
 * TIMED_OUT carries one only when an earlier phase left an incumbent.
 */
@Value
public class SolveOutcome {
    SolveStatus status;
    Assignment assignment;
    SolveStatistics statistics;

    public boolean hasAssignment() {
        return assignment != null;
    }
}
