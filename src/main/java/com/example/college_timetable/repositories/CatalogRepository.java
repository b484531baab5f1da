package com.example.college_timetable.repositories;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import jakarta.persistence.EntityManager;

import org.springframework.stereotype.Repository;

import com.example.college_timetable.catalog.Catalog;
import com.example.college_timetable.catalog.ConstraintInfo;
import com.example.college_timetable.catalog.CourseInfo;
import com.example.college_timetable.catalog.OfferingInfo;
import com.example.college_timetable.catalog.RoomInfo;
import com.example.college_timetable.catalog.SectionInfo;
import com.example.college_timetable.catalog.TeacherInfo;
import com.example.college_timetable.catalog.TimeSlotInfo;
import com.example.college_timetable.entities.Course;
import com.example.college_timetable.entities.Offering;
import com.example.college_timetable.entities.Room;
import com.example.college_timetable.entities.SchedulingConstraint;
import com.example.college_timetable.entities.Section;
import com.example.college_timetable.entities.Teacher;
import com.example.college_timetable.entities.TimeSlot;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads the scheduling data into an immutable {@link Catalog}. Inactive rooms,
 * time slots, courses, sections and constraints are left out. Teachers are all
 * loaded so the generator can report offerings of inactive ones.
 */
@Slf4j
@Repository
public class CatalogRepository {
    private final EntityManager entityManager;

    public CatalogRepository(EntityManager entityManager) {
        this.entityManager = entityManager;
    }

    public Catalog loadCatalog() {
        List<Teacher> teachers = entityManager
            .createQuery("SELECT t FROM Teacher t ORDER BY t.id", Teacher.class)
            .getResultList();
        List<Course> courses = entityManager
            .createQuery("SELECT c FROM Course c WHERE c.active = true ORDER BY c.id", Course.class)
            .getResultList();
        List<Section> sections = entityManager
            .createQuery("SELECT s FROM Section s WHERE s.active = true ORDER BY s.id", Section.class)
            .getResultList();
        List<Room> rooms = entityManager
            .createQuery("SELECT r FROM Room r WHERE r.active = true ORDER BY r.id", Room.class)
            .getResultList();
        List<TimeSlot> timeSlots = entityManager
            .createQuery("SELECT ts FROM TimeSlot ts WHERE ts.active = true ORDER BY ts.dayOfWeek, ts.period", TimeSlot.class)
            .getResultList();
        List<Offering> offerings = entityManager
            .createQuery(
                "SELECT o FROM Offering o JOIN FETCH o.course c JOIN FETCH o.teacher JOIN FETCH o.section s "
                    + "WHERE c.active = true AND s.active = true ORDER BY o.id", Offering.class)
            .getResultList();
        List<SchedulingConstraint> constraints = entityManager
            .createQuery("SELECT sc FROM SchedulingConstraint sc WHERE sc.active = true ORDER BY sc.id",
                SchedulingConstraint.class)
            .getResultList();

        Catalog.CatalogBuilder builder = Catalog.builder();
        teachers.forEach(t -> builder.teacher(toInfo(t)));
        courses.forEach(c -> builder.course(toInfo(c)));
        sections.forEach(s -> builder.section(toInfo(s)));
        rooms.forEach(r -> builder.room(toInfo(r)));
        timeSlots.forEach(ts -> builder.timeSlot(toInfo(ts)));
        offerings.forEach(o -> builder.offering(toInfo(o)));
        constraints.forEach(sc -> builder.constraint(toInfo(sc)));
        Catalog catalog = builder.build();

        log.info("Loaded catalog: {} teachers, {} courses, {} sections, {} rooms, {} time slots, {} offerings, {} constraints",
            teachers.size(), courses.size(), sections.size(), rooms.size(), timeSlots.size(),
            offerings.size(), constraints.size());
        return catalog;
    }

    /** Every time slot, active or not. Stored slots may still point at retired ones. */
    public List<TimeSlotInfo> loadAllTimeSlots() {
        return entityManager
            .createQuery("SELECT ts FROM TimeSlot ts ORDER BY ts.dayOfWeek, ts.period", TimeSlot.class)
            .getResultList()
            .stream()
            .map(timeSlot -> toInfo(timeSlot))
            .collect(Collectors.toList());
    }

    public Optional<Offering> findOfferingById(Long id) {
        return find(Offering.class, id);
    }

    public Optional<Room> findRoomById(Long id) {
        return find(Room.class, id);
    }

    public Optional<TimeSlot> findTimeSlotById(Long id) {
        return find(TimeSlot.class, id);
    }

    private <T> Optional<T> find(Class<T> type, Long id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entityManager.find(type, id));
    }

    private static TeacherInfo toInfo(Teacher teacher) {
        return TeacherInfo.builder()
            .id(teacher.getId())
            .code(teacher.getCode())
            .name(teacher.getName())
            .maxWeeklyLoad(teacher.getMaxWeeklyLoad())
            .active(teacher.isActive())
            .build();
    }

    private static CourseInfo toInfo(Course course) {
        return CourseInfo.builder()
            .id(course.getId())
            .code(course.getCode())
            .name(course.getName())
            .creditHours(course.getCreditHours())
            .sessionsPerWeek(course.getSessionsPerWeek())
            .sessionDuration(course.getSessionDuration())
            .lab(course.isLab())
            .program(course.getProgram())
            .semester(course.getSemester())
            .build();
    }

    private static SectionInfo toInfo(Section section) {
        return SectionInfo.builder()
            .id(section.getId())
            .name(section.getName())
            .program(section.getProgram())
            .semester(section.getSemester())
            .letter(section.getLetter())
            .studentCount(section.getStudentCount())
            .build();
    }

    private static RoomInfo toInfo(Room room) {
        return RoomInfo.builder()
            .id(room.getId())
            .number(room.getNumber())
            .roomType(room.getRoomType())
            .capacity(room.getCapacity())
            .build();
    }

    private static TimeSlotInfo toInfo(TimeSlot timeSlot) {
        return TimeSlotInfo.builder()
            .id(timeSlot.getId())
            .dayOfWeek(timeSlot.getDayOfWeek())
            .period(timeSlot.getPeriod())
            .startTime(timeSlot.getStartTime())
            .endTime(timeSlot.getEndTime())
            .breakSlot(timeSlot.isBreakSlot())
            .build();
    }

    private static OfferingInfo toInfo(Offering offering) {
        return OfferingInfo.builder()
            .id(offering.getId())
            .courseId(offering.getCourse().getId())
            .teacherId(offering.getTeacher().getId())
            .sectionId(offering.getSection().getId())
            .sessionsPerWeek(offering.getSessionsPerWeek())
            .build();
    }

    private static ConstraintInfo toInfo(SchedulingConstraint constraint) {
        return ConstraintInfo.builder()
            .id(constraint.getId())
            .type(constraint.getType())
            .teacherId(constraint.getTeacher() != null ? constraint.getTeacher().getId() : null)
            .roomId(constraint.getRoom() != null ? constraint.getRoom().getId() : null)
            .sectionId(constraint.getSection() != null ? constraint.getSection().getId() : null)
            .timeSlotId(constraint.getTimeSlot() != null ? constraint.getTimeSlot().getId() : null)
            .dayOfWeek(constraint.getDayOfWeek())
            .period(constraint.getPeriod())
            .weight(constraint.getWeight())
            .build();
    }
}
