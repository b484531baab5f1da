package com.example.college_timetable.catalog;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class CourseInfo {
    public static final int DEFAULT_LAB_BLOCK = 2;

    long id;
    String code;
    String name;
    int creditHours;
    int sessionsPerWeek;

    @Builder.Default
    int sessionDuration = 1;

    boolean lab;
    String program;
    String semester;

    /**
     * Number of consecutive periods one session occupies. Labs always take a
     * block of at least {@link #DEFAULT_LAB_BLOCK} periods.
     */
    public int blockLength() {
        if (lab) {
            return sessionDuration >= DEFAULT_LAB_BLOCK ? sessionDuration : DEFAULT_LAB_BLOCK;
        }
        return Math.max(1, sessionDuration);
    }
}
