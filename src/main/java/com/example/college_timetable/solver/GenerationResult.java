package com.example.college_timetable.solver;

import com.example.college_timetable.enums.GenerationStatus;
import com.example.college_timetable.enums.SolveStatus;
import com.example.college_timetable.exceptions.ConflictDetectedException;
import com.example.college_timetable.exceptions.InfeasibleCandidateException;
import com.example.college_timetable.exceptions.TimetableException;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * What a generation run hands back: a complete timetable, or the reason there
 * is none. Only successful results carry a timetable; failed ones carry the
 * error when one was raised.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GenerationResult {
    GenerationStatus status;
    // null when the run stopped before the solver
    SolveStatus solveStatus;
    Timetable timetable;
    TimetableException error;
    SolveStatistics statistics;
    int instanceCount;
    int candidateCount;

    public static GenerationResult success(SolveStatus solveStatus, Timetable timetable, SolveStatistics statistics,
                                           int instanceCount, int candidateCount) {
        return new GenerationResult(GenerationStatus.SUCCESS, solveStatus, timetable, null, statistics,
            instanceCount, candidateCount);
    }

    public static GenerationResult infeasibleCandidate(InfeasibleCandidateException error) {
        return new GenerationResult(GenerationStatus.INFEASIBLE_CANDIDATE, null, null, error, SolveStatistics.EMPTY, 0, 0);
    }

    public static GenerationResult infeasible(SolveStatus solveStatus, SolveStatistics statistics,
                                              int instanceCount, int candidateCount) {
        return new GenerationResult(GenerationStatus.INFEASIBLE, solveStatus, null, null, statistics,
            instanceCount, candidateCount);
    }

    public static GenerationResult conflict(ConflictDetectedException error, SolveStatus solveStatus,
                                            SolveStatistics statistics, int instanceCount, int candidateCount) {
        return new GenerationResult(GenerationStatus.CONFLICT_DETECTED, solveStatus, null, error, statistics,
            instanceCount, candidateCount);
    }

    /** Same result over a re-keyed timetable, e.g. after the slots got database ids. */
    public GenerationResult withTimetable(Timetable replacement) {
        if (!isSuccess()) {
            throw new IllegalStateException("A failed generation has no timetable");
        }
        return new GenerationResult(status, solveStatus, replacement, error, statistics, instanceCount, candidateCount);
    }

    public boolean isSuccess() {
        return status.isSuccess();
    }

    public String describe() {
        switch (status) {
            case SUCCESS:
                return String.format("Generated %d slots (%s)", timetable.size(), solveStatus);
            case INFEASIBLE:
                return "No timetable possible with current data and constraints (" + solveStatus + ")";
            default:
                return error.getMessage();
        }
    }
}
