package com.example.college_timetable.solver;

import java.util.HashMap;
import java.util.Map;

import com.example.college_timetable.catalog.Catalog;
import com.example.college_timetable.catalog.TeacherInfo;
import com.example.college_timetable.exceptions.ConflictDetectedException;
import com.example.college_timetable.exceptions.InfeasibleCandidateException;

import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of the solving core. One call is one batch generation:
 * candidates, model, solve, mapping. Nothing is kept between calls.
 */
@Slf4j
public class TimetableEngine {
    private final CandidateGenerator candidateGenerator;
    private final TimetableModelBuilder modelBuilder;
    private final SolutionMapper solutionMapper;

    public TimetableEngine() {
        this(new CandidateGenerator(), new TimetableModelBuilder(), new SolutionMapper(new ConflictChecker()));
    }

    public TimetableEngine(CandidateGenerator candidateGenerator, TimetableModelBuilder modelBuilder,
                           SolutionMapper solutionMapper) {
        this.candidateGenerator = candidateGenerator;
        this.modelBuilder = modelBuilder;
        this.solutionMapper = solutionMapper;
    }

    public GenerationResult generate(Catalog catalog, EngineSettings settings) {
        return generate(catalog, settings, SolveListener.NONE);
    }

    public GenerationResult generate(Catalog catalog, EngineSettings settings, SolveListener listener) {
        log.info("Generating timetable for {} offerings, {} rooms, {} teachable time slots",
            catalog.getOfferings().size(), catalog.getRooms().size(), catalog.getGrid().getTeachableSlots().size());

        CandidatePool pool;
        try {
            pool = candidateGenerator.generate(catalog);
        } catch (InfeasibleCandidateException e) {
            log.warn("Generation stopped before solving: {}", e.getMessage());
            return GenerationResult.infeasibleCandidate(e);
        }
        warnOnLoadOverflow(catalog, pool);

        TimetableModel model = modelBuilder.build(catalog, pool, settings.getWeights());
        SolveOutcome outcome = new SolverEngine(settings, listener).solve(model);
        int instances = pool.getInstances().size();

        if (!outcome.hasAssignment()) {
            log.warn("No timetable possible with current data and constraints ({})", outcome.getStatus());
            return GenerationResult.infeasible(outcome.getStatus(), outcome.getStatistics(), instances, pool.size());
        }

        try {
            Timetable timetable = solutionMapper.map(model, outcome.getAssignment());
            log.info("Generated timetable with {} slots ({})", timetable.size(), outcome.getStatus());
            return GenerationResult.success(outcome.getStatus(), timetable, outcome.getStatistics(), instances, pool.size());
        } catch (ConflictDetectedException e) {
            log.error("Generated timetable rejected", e);
            return GenerationResult.conflict(e, outcome.getStatus(), outcome.getStatistics(), instances, pool.size());
        }
    }

    // Overload makes the model infeasible; say which teacher before the solver does
    private static void warnOnLoadOverflow(Catalog catalog, CandidatePool pool) {
        Map<Long, Integer> demand = new HashMap<>();
        for (SessionInstance instance : pool.getInstances()) {
            demand.merge(instance.getTeacherId(), instance.getBlockLength(), Integer::sum);
        }
        demand.forEach((teacherId, periods) -> {
            TeacherInfo teacher = catalog.teacher(teacherId);
            if (periods > teacher.getMaxWeeklyLoad()) {
                log.warn("Teacher {} needs {} periods but max weekly load is {}",
                    teacher.getCode(), periods, teacher.getMaxWeeklyLoad());
            }
        });
    }
}
