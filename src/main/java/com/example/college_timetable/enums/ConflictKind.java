package com.example.college_timetable.enums;

public enum ConflictKind {
  TEACHER,
  ROOM,
  SECTION
}
