package com.example.college_timetable.catalog;

import java.time.DayOfWeek;

import com.example.college_timetable.enums.ConstraintType;

import lombok.Builder;
import lombok.Value;

/**
 * An admin-entered scheduling rule. It targets either one time slot, or a whole
 * day (optionally narrowed to one period number) when {@code timeSlotId} is null.
 */
@Value
@Builder(toBuilder = true)
public class ConstraintInfo {
    long id;
    ConstraintType type;
    Long teacherId;
    Long roomId;
    Long sectionId;
    Long timeSlotId;
    DayOfWeek dayOfWeek;
    Integer period;

    @Builder.Default
    int weight = 1;

    public boolean matches(TimeSlotInfo slot) {
        if (timeSlotId != null) {
            return timeSlotId == slot.getId();
        }
        if (dayOfWeek == null || dayOfWeek != slot.getDayOfWeek()) {
            return false;
        }
        return period == null || period == slot.getPeriod();
    }

    public boolean isHard() {
        return type.isHard();
    }
}
