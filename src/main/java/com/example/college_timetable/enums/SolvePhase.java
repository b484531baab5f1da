package com.example.college_timetable.enums;

public enum SolvePhase {
  FEASIBILITY,
  OPTIMIZATION
}
