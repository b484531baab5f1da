package com.example.college_timetable.repositories;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import com.example.college_timetable.entities.Course;
import com.example.college_timetable.entities.Offering;
import com.example.college_timetable.entities.Room;
import com.example.college_timetable.entities.Section;
import com.example.college_timetable.entities.Teacher;
import com.example.college_timetable.entities.TimeSlot;
import com.example.college_timetable.entities.TimetableGeneration;
import com.example.college_timetable.entities.TimetableSlot;
import com.example.college_timetable.enums.GenerationStatus;
import com.example.college_timetable.enums.SolveStatus;

@DataJpaTest
@Import({TimetableSlotRepository.class, TimetableGenerationRepository.class})
class TimetableSlotRepositoryTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private TimetableSlotRepository slotRepository;

    @Autowired
    private TimetableGenerationRepository generationRepository;

    private Offering offering;
    private Room room;
    private TimeSlot first;
    private TimeSlot second;

    @BeforeEach
    void setUp() {
        Teacher teacher = entityManager.persist(CatalogRepositoryTest.teacher("T-1", true));
        Course course = entityManager.persist(CatalogRepositoryTest.course("CS101", true));
        Section section = entityManager.persist(CatalogRepositoryTest.section());
        offering = entityManager.persist(CatalogRepositoryTest.offering(course, teacher, section));
        room = entityManager.persist(CatalogRepositoryTest.room("A-1", true));
        first = entityManager.persist(CatalogRepositoryTest.timeSlot(DayOfWeek.MONDAY, 1, false));
        second = entityManager.persist(CatalogRepositoryTest.timeSlot(DayOfWeek.MONDAY, 2, false));
    }

    private TimetableSlot slot(TimeSlot timeSlot) {
        TimetableSlot slot = new TimetableSlot();
        slot.setOffering(offering);
        slot.setSessionIndex(1);
        slot.setTimeSlot(timeSlot);
        slot.setBlockLength(1);
        slot.setRoom(room);
        return slot;
    }

    @Test
    @DisplayName("replaceAll drops the previous timetable")
    void replaceAll() {
        slotRepository.replaceAll(List.of(slot(first)));
        List<TimetableSlot> stored = slotRepository.replaceAll(List.of(slot(second)));
        entityManager.clear();

        List<TimetableSlot> all = slotRepository.findAll();
        assertThat(all).hasSize(1);
        assertThat(all.get(0).getId()).isEqualTo(stored.get(0).getId());
        assertThat(all.get(0).getTimeSlot().getId()).isEqualTo(second.getId());
    }

    @Test
    @DisplayName("save updates a moved slot")
    void saveMovedSlot() {
        Long id = slotRepository.replaceAll(List.of(slot(first))).get(0).getId();
        entityManager.clear();

        TimetableSlot loaded = slotRepository.findById(id).orElseThrow();
        loaded.setTimeSlot(entityManager.find(TimeSlot.class, second.getId()));
        slotRepository.save(loaded);
        entityManager.flush();
        entityManager.clear();

        assertThat(slotRepository.findById(id).orElseThrow().getTimeSlot().getId()).isEqualTo(second.getId());
        assertThat(slotRepository.findById(null)).isEmpty();
    }

    @Test
    @DisplayName("the latest generation record is the most recent run")
    void latestGeneration() {
        generationRepository.save(generation(LocalDateTime.of(2024, 1, 1, 9, 0), GenerationStatus.INFEASIBLE));
        generationRepository.save(generation(LocalDateTime.of(2024, 1, 2, 9, 0), GenerationStatus.SUCCESS));

        assertThat(generationRepository.findLatest()).hasValueSatisfying(
            latest -> assertThat(latest.getStatus()).isEqualTo(GenerationStatus.SUCCESS));
        assertThat(generationRepository.findAll()).hasSize(2);
    }

    private static TimetableGeneration generation(LocalDateTime at, GenerationStatus status) {
        TimetableGeneration generation = new TimetableGeneration();
        generation.setGeneratedAt(at);
        generation.setStatus(status);
        generation.setSolveStatus(status.isSuccess() ? SolveStatus.OPTIMAL : SolveStatus.INFEASIBLE);
        generation.setNotes(status.name());
        return generation;
    }
}
