package com.example.college_timetable.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;

import jakarta.persistence.EntityManager;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import com.example.college_timetable.entities.Course;
import com.example.college_timetable.entities.Offering;
import com.example.college_timetable.entities.Room;
import com.example.college_timetable.entities.Section;
import com.example.college_timetable.entities.Teacher;
import com.example.college_timetable.entities.TimeSlot;
import com.example.college_timetable.enums.MoveRule;
import com.example.college_timetable.enums.RoomType;
import com.example.college_timetable.exceptions.InvalidMoveException;
import com.example.college_timetable.repositories.TimetableGenerationRepository;
import com.example.college_timetable.repositories.TimetableSlotRepository;
import com.example.college_timetable.solver.GenerationResult;
import com.example.college_timetable.solver.ScheduledSlot;
import com.example.college_timetable.solver.Timetable;

@SpringBootTest
@Transactional
class TimetableServiceIntegrationTest {

    @Autowired
    private TimetableService timetableService;

    @Autowired
    private TimetableSlotRepository slotRepository;

    @Autowired
    private TimetableGenerationRepository generationRepository;

    @Autowired
    private EntityManager entityManager;

    @BeforeEach
    void seed() {
        Teacher first = teacher("T-1");
        Teacher second = teacher("T-2");
        Course programming = course("CS101", 2, false);
        Course programmingLab = course("CS101L", 1, true);
        Section section = new Section();
        section.setName("BSCS-1A");
        section.setProgram("BSCS");
        section.setSemester("1");
        section.setLetter("A");
        section.setStudentCount(35);
        entityManager.persist(section);

        room("R-101", RoomType.CLASSROOM);
        room("LAB-1", RoomType.LAB);
        for (DayOfWeek day : new DayOfWeek[] {DayOfWeek.MONDAY, DayOfWeek.TUESDAY}) {
            for (int period = 1; period <= 4; period++) {
                TimeSlot slot = new TimeSlot();
                slot.setDayOfWeek(day);
                slot.setPeriod(period);
                slot.setStartTime(LocalTime.of(8 + period, 0));
                slot.setEndTime(LocalTime.of(9 + period, 0));
                entityManager.persist(slot);
            }
        }

        offering(programming, first, section);
        offering(programmingLab, second, section);
        entityManager.flush();
    }

    @Test
    @DisplayName("a generated timetable is stored, recorded and free of conflicts")
    void generateAndStore() {
        GenerationResult result = timetableService.generate(Duration.ofSeconds(10));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getTimetable().size()).isEqualTo(3);
        assertThat(slotRepository.findAll()).hasSize(3);
        assertThat(timetableService.checkConflicts()).isEmpty();
        assertThat(generationRepository.findLatest()).hasValueSatisfying(generation -> {
            assertThat(generation.getSlotCount()).isEqualTo(3);
            assertThat(generation.getStatus().isSuccess()).isTrue();
        });
    }

    @Test
    @DisplayName("a stored slot can be moved to a free period and back")
    void moveRoundTrip() {
        timetableService.generate(Duration.ofSeconds(10));
        Timetable current = timetableService.currentTimetable();
        ScheduledSlot theory = current.getSlots().stream()
            .filter(slot -> slot.getBlockLength() == 1)
            .findFirst()
            .orElseThrow();
        long free = timetableService.loadCatalog().getGrid().getTeachableSlots().stream()
            .map(slot -> slot.getId())
            .filter(id -> current.getSlots().stream().noneMatch(slot -> slot.occupies(id)))
            .findFirst()
            .orElseThrow();

        ScheduledSlot moved = timetableService.move(theory.getId(), free, null);
        assertThat(moved.getTimeSlotIds()).containsExactly(free);
        assertThat(timetableService.checkConflicts()).isEmpty();

        ScheduledSlot restored = timetableService.move(theory.getId(), theory.getFirstTimeSlotId(), theory.getRoomId());
        assertThat(restored).isEqualTo(theory);
    }

    @Test
    @DisplayName("deactivating a course or time slot after generation keeps the stored timetable readable")
    void deactivatedAfterGeneration() {
        timetableService.generate(Duration.ofSeconds(10));
        Timetable generated = timetableService.currentTimetable();
        ScheduledSlot theory = generated.getSlots().stream()
            .filter(slot -> slot.getBlockLength() == 1)
            .findFirst()
            .orElseThrow();
        ScheduledSlot lab = generated.getSlots().stream()
            .filter(slot -> slot.getBlockLength() == 2)
            .findFirst()
            .orElseThrow();

        entityManager.createQuery("SELECT c FROM Course c WHERE c.code = :code", Course.class)
            .setParameter("code", "CS101")
            .getSingleResult()
            .setActive(false);
        entityManager.find(TimeSlot.class, lab.getFirstTimeSlotId()).setActive(false);
        entityManager.flush();
        entityManager.clear();

        assertThat(timetableService.currentTimetable().getSlots()).containsExactlyInAnyOrderElementsOf(generated.getSlots());
        assertThat(timetableService.checkConflicts()).isEmpty();
        assertThatThrownBy(() -> timetableService.move(theory.getId(), lab.getFirstTimeSlotId(), null))
            .isInstanceOfSatisfying(InvalidMoveException.class,
                e -> assertThat(e.getRule()).isEqualTo(MoveRule.INACTIVE_OFFERING));
    }

    private Teacher teacher(String code) {
        Teacher teacher = new Teacher();
        teacher.setCode(code);
        teacher.setName("Teacher " + code);
        teacher.setMaxWeeklyLoad(6);
        entityManager.persist(teacher);
        return teacher;
    }

    private Course course(String code, int sessionsPerWeek, boolean lab) {
        Course course = new Course();
        course.setCode(code);
        course.setName(code);
        course.setCreditHours(sessionsPerWeek);
        course.setSessionsPerWeek(sessionsPerWeek);
        course.setLab(lab);
        course.setSessionDuration(lab ? 2 : 1);
        entityManager.persist(course);
        return course;
    }

    private void room(String number, RoomType type) {
        Room room = new Room();
        room.setNumber(number);
        room.setRoomType(type);
        room.setCapacity(40);
        entityManager.persist(room);
    }

    private void offering(Course course, Teacher teacher, Section section) {
        Offering offering = new Offering();
        offering.setCourse(course);
        offering.setTeacher(teacher);
        offering.setSection(section);
        entityManager.persist(offering);
    }
}
