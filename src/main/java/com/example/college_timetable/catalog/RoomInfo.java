package com.example.college_timetable.catalog;

import com.example.college_timetable.enums.RoomType;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class RoomInfo {
    long id;
    String number;
    RoomType roomType;
    int capacity;
}
