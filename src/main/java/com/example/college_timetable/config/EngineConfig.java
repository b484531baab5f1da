package com.example.college_timetable.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.college_timetable.edit.TimetableEditor;
import com.example.college_timetable.solver.CandidateGenerator;
import com.example.college_timetable.solver.ConflictChecker;
import com.example.college_timetable.solver.SolutionMapper;
import com.example.college_timetable.solver.TimetableEngine;
import com.example.college_timetable.solver.TimetableModelBuilder;

/**
 * The solving core has no Spring annotations of its own; it is wired here.
 */
@Configuration
public class EngineConfig {

    @Bean
    public ConflictChecker conflictChecker() {
        return new ConflictChecker();
    }

    @Bean
    public TimetableEngine timetableEngine(ConflictChecker conflictChecker) {
        return new TimetableEngine(new CandidateGenerator(), new TimetableModelBuilder(), new SolutionMapper(conflictChecker));
    }

    @Bean
    public TimetableEditor timetableEditor(ConflictChecker conflictChecker) {
        return new TimetableEditor(conflictChecker);
    }
}
