package com.example.college_timetable.enums;

public enum RoomType {
  CLASSROOM,
  LAB,
  SEMINAR,
  AUDITORIUM;

  // lab sessions need lab rooms; theory may use any room, labs included
  public boolean canHost(boolean labSession) {
      return !labSession || this == LAB;
  }
}
