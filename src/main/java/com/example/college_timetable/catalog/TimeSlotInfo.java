package com.example.college_timetable.catalog;

import java.time.DayOfWeek;
import java.time.LocalTime;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class TimeSlotInfo {
    long id;
    DayOfWeek dayOfWeek;
    int period;
    LocalTime startTime;
    LocalTime endTime;
    boolean breakSlot;

    public String label() {
        return dayOfWeek + " P" + period;
    }
}
