package com.example.college_timetable.solver;

import com.example.college_timetable.enums.ConflictKind;

import lombok.Value;

/**
 * Two scheduled slots holding the same teacher, room or section at the same
 * time slot.
 */
@Value
public class Conflict {
    ConflictKind kind;
    long resourceId;
    long timeSlotId;
    long firstSlotId;
    long secondSlotId;

    public String describe() {
        return String.format("%s %d double-booked at time slot %d by slots %d and %d",
            kind, resourceId, timeSlotId, firstSlotId, secondSlotId);
    }
}
