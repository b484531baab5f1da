package com.example.college_timetable.exceptions;

import com.example.college_timetable.solver.Conflict;

import lombok.Getter;

/**
 * The integrity sweep found two scheduled slots that clash. This always points
 * at a defect in model building; the whole generated batch is rejected.
 */
@Getter
public class ConflictDetectedException extends TimetableException {
    private final Conflict conflict;

    public ConflictDetectedException(Conflict conflict) {
        super("Conflict detected in generated timetable: " + conflict.describe());
        this.conflict = conflict;
    }
}
