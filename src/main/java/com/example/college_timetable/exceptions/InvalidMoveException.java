package com.example.college_timetable.exceptions;

import com.example.college_timetable.enums.MoveRule;

import lombok.Getter;

@Getter
public class InvalidMoveException extends TimetableException {
    private final MoveRule rule;
    private final long slotId;

    public InvalidMoveException(MoveRule rule, long slotId, String message) {
        super(String.format("Cannot move slot %d (%s): %s", slotId, rule, message));
        this.rule = rule;
        this.slotId = slotId;
    }
}
