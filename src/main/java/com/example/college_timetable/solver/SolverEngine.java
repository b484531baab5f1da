package com.example.college_timetable.solver;

import java.time.Duration;

import com.example.college_timetable.enums.SolvePhase;
import com.example.college_timetable.enums.SolveStatus;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs CP-SAT over a {@link TimetableModel}. With feasibility-first enabled the
 * search runs in two phases: the hard constraints alone, then the objective
 * seeded with the first solution. If the second phase runs out of time the
 * first phase's timetable is kept.
 *
 * <p>One engine serves one run: {@code UNSOLVED -> SOLVING -> terminal}. A run
 * that throws leaves the engine {@code FAILED}.
 */
@Slf4j
public class SolverEngine {
    private final EngineSettings settings;
    private final SolveListener listener;
    private volatile SolveStatus status = SolveStatus.UNSOLVED;

    public SolverEngine(EngineSettings settings, SolveListener listener) {
        this.settings = settings;
        this.listener = listener;
    }

    public SolveStatus getStatus() {
        return status;
    }

    public SolveOutcome solve(TimetableModel model) {
        if (status != SolveStatus.UNSOLVED) {
            throw new IllegalStateException("Solver engine already used, status " + status);
        }
        OrToolsNatives.ensureLoaded();
        status = SolveStatus.SOLVING;
        long startedAt = System.nanoTime();

        SolveOutcome outcome = null;
        try {
            if (settings.isFeasibilityFirst() && model.hasObjective()) {
                outcome = solveInPhases(model, startedAt);
            } else {
                model.applyObjective();
                SolvePhase phase = model.hasObjective() ? SolvePhase.OPTIMIZATION : SolvePhase.FEASIBILITY;
                outcome = runPhase(model, phase, remaining(startedAt));
            }
        } finally {
            status = outcome != null ? outcome.getStatus() : SolveStatus.FAILED;
        }

        log.info("Solve finished: {} in {}s ({} branches, {} conflicts, objective {})",
            outcome.getStatus(),
            String.format("%.2f", outcome.getStatistics().getWallTimeSeconds()),
            outcome.getStatistics().getBranches(),
            outcome.getStatistics().getConflicts(),
            outcome.getStatistics().getObjectiveValue());
        return outcome;
    }

    private SolveOutcome solveInPhases(TimetableModel model, long startedAt) {
        SolveOutcome feasible = runPhase(model, SolvePhase.FEASIBILITY, remaining(startedAt));
        if (!feasible.hasAssignment()) {
            return feasible;
        }

        Duration left = remaining(startedAt);
        if (left != null && left.isZero()) {
            log.info("Time limit used up by the feasibility phase, keeping its timetable");
            return new SolveOutcome(SolveStatus.TIMED_OUT, feasible.getAssignment(), feasible.getStatistics());
        }

        model.applyObjective();
        model.addHints(feasible.getAssignment());
        SolveOutcome optimised = runPhase(model, SolvePhase.OPTIMIZATION, left);
        if (optimised.hasAssignment()) {
            return optimised;
        }
        if (optimised.getStatus() == SolveStatus.INFEASIBLE) {
            log.warn("Optimisation phase reported INFEASIBLE after a feasible phase, keeping the feasible timetable");
        }
        return new SolveOutcome(SolveStatus.TIMED_OUT, feasible.getAssignment(), optimised.getStatistics());
    }

    private SolveOutcome runPhase(TimetableModel model, SolvePhase phase, Duration limit) {
        log.info("Starting {} phase (time limit: {})", phase, limit == null ? "none" : limit);
        CpSolver solver = newSolver(limit);
        CpSolverStatus raw = solver.solve(model.getModel());

        SolveOutcome outcome;
        if (raw == CpSolverStatus.OPTIMAL) {
            outcome = new SolveOutcome(SolveStatus.OPTIMAL, SolvedAssignment.capture(solver, model),
                statisticsOf(solver, phase == SolvePhase.OPTIMIZATION));
        } else if (raw == CpSolverStatus.FEASIBLE) {
            outcome = new SolveOutcome(SolveStatus.FEASIBLE, SolvedAssignment.capture(solver, model),
                statisticsOf(solver, phase == SolvePhase.OPTIMIZATION));
        } else if (raw == CpSolverStatus.INFEASIBLE) {
            outcome = new SolveOutcome(SolveStatus.INFEASIBLE, null, statisticsOf(solver, false));
        } else if (raw == CpSolverStatus.UNKNOWN) {
            outcome = new SolveOutcome(SolveStatus.TIMED_OUT, null, statisticsOf(solver, false));
        } else {
            throw new IllegalStateException("CP-SAT rejected the timetable model (" + raw + "): "
                + model.getModel().validate());
        }

        log.info("{} phase ended with {}", phase, outcome.getStatus());
        listener.onPhaseComplete(phase, outcome.getStatus(), outcome.getStatistics());
        return outcome;
    }

    private CpSolver newSolver(Duration limit) {
        CpSolver solver = new CpSolver();
        solver.getParameters().setNumWorkers(settings.getNumWorkers());
        solver.getParameters().setLogSearchProgress(settings.isLogSearchProgress());
        if (settings.isLogSearchProgress()) {
            solver.getParameters().setLogToStdout(false);
            solver.setLogCallback(line -> log.info("[cp-sat] {}", line));
        }
        if (limit != null) {
            solver.getParameters().setMaxTimeInSeconds(Math.max(0.001, limit.toMillis() / 1000.0));
        }
        if (settings.getRandomSeed() != null) {
            solver.getParameters().setRandomSeed(settings.getRandomSeed());
        }
        return solver;
    }

    private Duration remaining(long startedAt) {
        if (settings.getTimeLimit() == null) {
            return null;
        }
        Duration left = settings.getTimeLimit().minusNanos(System.nanoTime() - startedAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    private static SolveStatistics statisticsOf(CpSolver solver, boolean withObjective) {
        return new SolveStatistics(
            solver.wallTime(),
            solver.numBranches(),
            solver.numConflicts(),
            withObjective ? solver.objectiveValue() : null);
    }
}
