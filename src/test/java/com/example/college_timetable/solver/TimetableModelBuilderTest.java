package com.example.college_timetable.solver;

import static com.example.college_timetable.support.TestCatalogs.classroom;
import static com.example.college_timetable.support.TestCatalogs.offering;
import static com.example.college_timetable.support.TestCatalogs.section;
import static com.example.college_timetable.support.TestCatalogs.teacher;
import static com.example.college_timetable.support.TestCatalogs.theoryCourse;
import static com.example.college_timetable.support.TestCatalogs.week;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.college_timetable.catalog.Catalog;

class TimetableModelBuilderTest {

    @Test
    @DisplayName("a model can be built before anything else has touched OR-Tools")
    void buildsInFreshJvm() {
        Catalog catalog = Catalog.builder()
            .teacher(teacher(1, 10))
            .course(theoryCourse(1, 2))
            .section(section(1, 30))
            .room(classroom(1, 40))
            .timeSlots(week(2, 3))
            .offering(offering(1, 1, 1, 1))
            .build();
        CandidatePool pool = new CandidateGenerator().generate(catalog);

        TimetableModel model = new TimetableModelBuilder().build(catalog, pool, ObjectiveWeights.defaults());

        assertThat(OrToolsNatives.isLoaded()).isTrue();
        assertThat(model.getModel().validate()).isEmpty();
        assertThat(model.decisionCount()).isEqualTo(pool.size());
    }
}
