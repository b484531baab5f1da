package com.example.college_timetable.catalog;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class OfferingInfo {
    long id;
    long courseId;
    long teacherId;
    long sectionId;

    // null means "use the course's sessions per week"
    Integer sessionsPerWeek;
}
