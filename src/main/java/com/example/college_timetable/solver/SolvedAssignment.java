package com.example.college_timetable.solver;

import com.google.ortools.sat.CpSolver;

/**
 * Copy of the decision values of one solver response, so that it survives the
 * next solve on the same model.
 */
class SolvedAssignment implements Assignment {
    private final boolean[] selected;

    private SolvedAssignment(boolean[] selected) {
        this.selected = selected;
    }

    static SolvedAssignment capture(CpSolver solver, TimetableModel model) {
        boolean[] selected = new boolean[model.decisionCount()];
        for (Candidate candidate : model.getPool().getAllCandidates()) {
            selected[candidate.getIndex()] = solver.booleanValue(model.decision(candidate));
        }
        return new SolvedAssignment(selected);
    }

    @Override
    public boolean isSelected(Candidate candidate) {
        return selected[candidate.getIndex()];
    }
}
