package com.example.college_timetable.solver;

/**
 * Read-only view of a solved model: which candidate placements were chosen.
 */
@FunctionalInterface
public interface Assignment {

    boolean isSelected(Candidate candidate);
}
