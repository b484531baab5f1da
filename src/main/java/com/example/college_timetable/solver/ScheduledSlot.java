package com.example.college_timetable.solver;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * One placed session: the offering it belongs to, every time slot its block
 * covers (a single one for theory sessions) and the room it is held in.
 * Teacher, course and section are denormalised from the offering so clash
 * checks need no catalog.
 */
@Value
@Builder(toBuilder = true)
public class ScheduledSlot {
    long id;
    long offeringId;
    long courseId;
    long teacherId;
    long sectionId;
    int sessionIndex;
    List<Long> timeSlotIds;
    long roomId;

    public int getBlockLength() {
        return timeSlotIds.size();
    }

    public long getFirstTimeSlotId() {
        return timeSlotIds.get(0);
    }

    public boolean occupies(long timeSlotId) {
        return timeSlotIds.contains(timeSlotId);
    }
}
