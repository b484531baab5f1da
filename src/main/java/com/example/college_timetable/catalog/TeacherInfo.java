package com.example.college_timetable.catalog;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class TeacherInfo {
    long id;
    String code;
    String name;
    int maxWeeklyLoad;

    @Builder.Default
    boolean active = true;
}
