package com.example.college_timetable.solver;

import static com.example.college_timetable.support.TestCatalogs.classroom;
import static com.example.college_timetable.support.TestCatalogs.offering;
import static com.example.college_timetable.support.TestCatalogs.section;
import static com.example.college_timetable.support.TestCatalogs.teacher;
import static com.example.college_timetable.support.TestCatalogs.theoryCourse;
import static com.example.college_timetable.support.TestCatalogs.week;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.college_timetable.catalog.Catalog;
import com.example.college_timetable.enums.GenerationStatus;
import com.example.college_timetable.enums.SolvePhase;
import com.example.college_timetable.enums.SolveStatus;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.LinearExpr;

class SolverEngineTest {

    private static Catalog smallCatalog() {
        return Catalog.builder()
            .teacher(teacher(1, 10))
            .course(theoryCourse(1, 2))
            .section(section(1, 30))
            .room(classroom(1, 40))
            .timeSlots(week(2, 3))
            .offering(offering(1, 1, 1, 1))
            .build();
    }

    // every offering fits every room at every slot: ~100k decisions
    private static Catalog largeCatalog() {
        Catalog.CatalogBuilder builder = Catalog.builder().timeSlots(week(5, 8));
        for (long id = 1; id <= 30; id++) {
            builder.teacher(teacher(id, 20))
                .course(theoryCourse(id, 3))
                .section(section(id, 30))
                .room(classroom(id, 40))
                .offering(offering(id, id, id, id));
        }
        return builder.build();
    }

    private static TimetableModel model(ObjectiveWeights weights) {
        Catalog catalog = smallCatalog();
        return new TimetableModelBuilder().build(catalog, new CandidateGenerator().generate(catalog), weights);
    }

    @Test
    @DisplayName("an engine moves from UNSOLVED to a terminal status and cannot be reused")
    void singleUse() {
        SolverEngine engine = new SolverEngine(EngineSettings.builder().timeLimit(Duration.ofSeconds(5)).build(),
            SolveListener.NONE);
        assertThat(engine.getStatus()).isEqualTo(SolveStatus.UNSOLVED);

        SolveOutcome outcome = engine.solve(model(ObjectiveWeights.defaults()));

        assertThat(outcome.getStatus()).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(outcome.hasAssignment()).isTrue();
        assertThat(engine.getStatus()).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(engine.getStatus().isTerminal()).isTrue();
        assertThatThrownBy(() -> engine.solve(model(ObjectiveWeights.defaults())))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("without soft terms only the feasibility phase runs")
    void noObjective() {
        List<SolveStatistics> reported = new ArrayList<>();
        SolverEngine engine = new SolverEngine(EngineSettings.defaults(),
            (phase, status, statistics) -> reported.add(statistics));

        TimetableModel model = model(ObjectiveWeights.none());
        SolveOutcome outcome = engine.solve(model);

        assertThat(model.hasObjective()).isFalse();
        assertThat(outcome.hasAssignment()).isTrue();
        assertThat(reported).hasSize(1);
        assertThat(reported.get(0).getObjectiveValue()).isNull();
    }

    @Test
    @DisplayName("the optimisation phase reports its objective value")
    void objectiveReported() {
        SolverEngine engine = new SolverEngine(EngineSettings.defaults(), SolveListener.NONE);

        SolveOutcome outcome = engine.solve(model(ObjectiveWeights.defaults()));

        // one session per day, each on period 2: nothing to penalise
        assertThat(outcome.getStatistics().getObjectiveValue()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("running out of time before any solution is reported as no timetable")
    void timeoutWithoutIncumbent() {
        EngineSettings settings = EngineSettings.builder()
            .timeLimit(Duration.ofMillis(1))
            .numWorkers(1)
            .weights(ObjectiveWeights.none())
            .build();

        GenerationResult result = new TimetableEngine().generate(largeCatalog(), settings);

        assertThat(result.getSolveStatus()).isEqualTo(SolveStatus.TIMED_OUT);
        assertThat(result.getStatus()).isEqualTo(GenerationStatus.INFEASIBLE);
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getTimetable()).isNull();
    }

    @Test
    @DisplayName("when the feasibility phase uses up the time limit its timetable is kept")
    void timeoutAfterFeasiblePhase() {
        List<SolvePhase> phases = new ArrayList<>();
        EngineSettings settings = EngineSettings.builder().timeLimit(Duration.ofSeconds(1)).build();

        GenerationResult result = new TimetableEngine().generate(smallCatalog(), settings, (phase, status, statistics) -> {
            phases.add(phase);
            if (phase == SolvePhase.FEASIBILITY) {
                try {
                    Thread.sleep(1200);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }
        });

        assertThat(phases).containsExactly(SolvePhase.FEASIBILITY);
        assertThat(result.getSolveStatus()).isEqualTo(SolveStatus.TIMED_OUT);
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getTimetable().size()).isEqualTo(2);
    }

    @Test
    @DisplayName("a model CP-SAT rejects leaves the engine failed rather than solving")
    void rejectedModelFailsEngine() {
        TimetableModel model = model(ObjectiveWeights.none());
        IntVar overflowing = model.getModel().newIntVar(0, 10, "overflowing");
        model.getModel().addLessOrEqual(LinearExpr.term(overflowing, Long.MAX_VALUE), 0);
        SolverEngine engine = new SolverEngine(EngineSettings.defaults(), SolveListener.NONE);

        assertThatThrownBy(() -> engine.solve(model))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("rejected the timetable model");
        assertThat(engine.getStatus()).isEqualTo(SolveStatus.FAILED);
        assertThat(engine.getStatus().isTerminal()).isTrue();
    }
}
