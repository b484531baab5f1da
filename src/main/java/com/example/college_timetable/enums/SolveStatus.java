package com.example.college_timetable.enums;

public enum SolveStatus {
  UNSOLVED,
  SOLVING,
  OPTIMAL,
  FEASIBLE,
  INFEASIBLE,
  TIMED_OUT,
  // the solver rejected the model or threw
  FAILED;

  public boolean isTerminal() {
      return this != UNSOLVED && this != SOLVING;
  }
}
