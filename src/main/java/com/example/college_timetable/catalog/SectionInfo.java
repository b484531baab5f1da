package com.example.college_timetable.catalog;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class SectionInfo {
    long id;
    String name;
    String program;
    String semester;
    String letter;
    int studentCount;
}
