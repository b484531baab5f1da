package com.example.college_timetable.exceptions;

/**
 * Base type for failures the timetable engine reports to its callers.
 */
public abstract class TimetableException extends RuntimeException {

    protected TimetableException(String message) {
        super(message);
    }
}
