package com.example.college_timetable.enums;

import lombok.Getter;

@Getter
public enum ConstraintType {
  TEACHER_UNAVAILABLE(true),
  ROOM_UNAVAILABLE(true),
  SECTION_PREFERENCE(false),
  TIME_PREFERENCE(false);

  private final boolean hard;

  ConstraintType(final boolean hard){
      this.hard = hard;
  }
}
