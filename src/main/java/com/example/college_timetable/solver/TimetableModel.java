package com.example.college_timetable.solver;

import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.LinearExpr;

import lombok.Getter;

/**
 * A built CP-SAT model: one boolean decision per candidate placement plus the
 * soft objective, which is kept aside until the solver decides to optimise.
 */
public class TimetableModel {
    @Getter
    private final CpModel model;
    @Getter
    private final CandidatePool pool;
    private final BoolVar[] decisions;
    private final LinearExpr objective;
    @Getter
    private final int objectiveTerms;
    private boolean objectiveApplied;

    TimetableModel(CpModel model, CandidatePool pool, BoolVar[] decisions, LinearExpr objective, int objectiveTerms) {
        this.model = model;
        this.pool = pool;
        this.decisions = decisions;
        this.objective = objective;
        this.objectiveTerms = objectiveTerms;
    }

    public BoolVar decision(Candidate candidate) {
        return decisions[candidate.getIndex()];
    }

    public int decisionCount() {
        return decisions.length;
    }

    public boolean hasObjective() {
        return objectiveTerms > 0;
    }

    void applyObjective() {
        if (hasObjective() && !objectiveApplied) {
            model.minimize(objective);
            objectiveApplied = true;
        }
    }

    /** Seeds the next search with a known solution. */
    void addHints(Assignment assignment) {
        for (Candidate candidate : pool.getAllCandidates()) {
            model.addHint(decision(candidate), assignment.isSelected(candidate) ? 1 : 0);
        }
    }
}
