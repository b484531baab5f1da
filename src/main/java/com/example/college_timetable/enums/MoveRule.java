package com.example.college_timetable.enums;

/**
 * Rules checked when a scheduled slot is moved by hand, in evaluation order.
 */
public enum MoveRule {
  UNKNOWN_SLOT,
  // the slot's course or section was deactivated after it was stored
  INACTIVE_OFFERING,
  UNKNOWN_TIME_SLOT,
  UNKNOWN_ROOM,
  BREAK_SLOT,
  LAB_BLOCK_NOT_CONTIGUOUS,
  ROOM_TYPE,
  ROOM_CAPACITY,
  TEACHER_UNAVAILABLE,
  ROOM_UNAVAILABLE,
  ROOM_CONFLICT,
  TEACHER_CONFLICT,
  SECTION_CONFLICT
}
