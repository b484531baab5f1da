package com.example.college_timetable;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.example.college_timetable.catalog.Catalog;
import com.example.college_timetable.service.TimetableService;
import com.example.college_timetable.solver.GenerationResult;

/**
 * Generates once at startup when {@code timetable.run-on-startup} is true.
 */
@Component
@ConditionalOnProperty(name = "timetable.run-on-startup", havingValue = "true")
public class GenerateTimetableRunner implements CommandLineRunner {
    private final TimetableService timetableService;
    private final TimetableReport timetableReport;

    public GenerateTimetableRunner(TimetableService timetableService, TimetableReport timetableReport) {
        this.timetableService = timetableService;
        this.timetableReport = timetableReport;
    }

    @Override
    public void run(String... args) {
        // Dump the input first so a failed run can be inspected
        Catalog catalog = timetableService.loadCatalog();
        timetableReport.logCatalog(catalog);

        GenerationResult result = timetableService.generate(null);
        if (result.isSuccess()) {
            timetableReport.logTimetable(catalog, result.getTimetable());
        }
    }
}
