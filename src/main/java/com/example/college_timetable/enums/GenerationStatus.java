package com.example.college_timetable.enums;

public enum GenerationStatus {
  SUCCESS,
  INFEASIBLE_CANDIDATE,
  INFEASIBLE,
  CONFLICT_DETECTED;

  public boolean isSuccess() {
      return this == SUCCESS;
  }
}
