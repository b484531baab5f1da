package com.example.college_timetable.catalog;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.example.college_timetable.enums.ConstraintType;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * Immutable snapshot of everything one generation run reads: teachers, courses,
 * sections, rooms, time slots, offerings and the active constraints. Built once,
 * before the engine starts, and never touched by the engine afterwards.
 */
@Getter
public class Catalog {
    private final List<TeacherInfo> teachers;
    private final List<CourseInfo> courses;
    private final List<SectionInfo> sections;
    private final List<RoomInfo> rooms;
    private final List<TimeSlotInfo> timeSlots;
    private final List<OfferingInfo> offerings;
    private final List<ConstraintInfo> constraints;

    @Getter(AccessLevel.NONE)
    private final Map<Long, TeacherInfo> teachersById;
    @Getter(AccessLevel.NONE)
    private final Map<Long, CourseInfo> coursesById;
    @Getter(AccessLevel.NONE)
    private final Map<Long, SectionInfo> sectionsById;
    @Getter(AccessLevel.NONE)
    private final Map<Long, RoomInfo> roomsById;
    @Getter(AccessLevel.NONE)
    private final Map<Long, TimeSlotInfo> timeSlotsById;
    @Getter(AccessLevel.NONE)
    private final Map<Long, OfferingInfo> offeringsById;

    private final WeekGrid grid;

    @Builder
    public Catalog(@Singular List<TeacherInfo> teachers,
                   @Singular List<CourseInfo> courses,
                   @Singular List<SectionInfo> sections,
                   @Singular List<RoomInfo> rooms,
                   @Singular List<TimeSlotInfo> timeSlots,
                   @Singular List<OfferingInfo> offerings,
                   @Singular List<ConstraintInfo> constraints) {
        this.teachers = List.copyOf(teachers);
        this.courses = List.copyOf(courses);
        this.sections = List.copyOf(sections);
        this.rooms = List.copyOf(rooms);
        this.timeSlots = List.copyOf(timeSlots);
        this.offerings = List.copyOf(offerings);
        this.constraints = List.copyOf(constraints);

        this.teachersById = index(this.teachers, TeacherInfo::getId);
        this.coursesById = index(this.courses, CourseInfo::getId);
        this.sectionsById = index(this.sections, SectionInfo::getId);
        this.roomsById = index(this.rooms, RoomInfo::getId);
        this.timeSlotsById = index(this.timeSlots, TimeSlotInfo::getId);
        this.offeringsById = index(this.offerings, OfferingInfo::getId);
        this.grid = new WeekGrid(this.timeSlots);

        validateReferences();
    }

    public TeacherInfo teacher(long id) {
        return require(teachersById, id, "Teacher");
    }

    public CourseInfo course(long id) {
        return require(coursesById, id, "Course");
    }

    public SectionInfo section(long id) {
        return require(sectionsById, id, "Section");
    }

    public RoomInfo room(long id) {
        return require(roomsById, id, "Room");
    }

    public TimeSlotInfo timeSlot(long id) {
        return require(timeSlotsById, id, "Time slot");
    }

    public OfferingInfo offering(long id) {
        return require(offeringsById, id, "Offering");
    }

    public boolean hasCourse(long id) {
        return coursesById.containsKey(id);
    }

    public boolean hasSection(long id) {
        return sectionsById.containsKey(id);
    }

    public boolean hasRoom(long id) {
        return roomsById.containsKey(id);
    }

    public boolean hasTimeSlot(long id) {
        return timeSlotsById.containsKey(id);
    }

    public int sessionsPerWeek(OfferingInfo offering) {
        return offering.getSessionsPerWeek() != null
            ? offering.getSessionsPerWeek()
            : course(offering.getCourseId()).getSessionsPerWeek();
    }

    public boolean isTeacherUnavailable(long teacherId, TimeSlotInfo slot) {
        return constraints.stream()
            .anyMatch(c -> c.getType() == ConstraintType.TEACHER_UNAVAILABLE
                && c.getTeacherId() != null && c.getTeacherId() == teacherId
                && c.matches(slot));
    }

    public boolean isRoomUnavailable(long roomId, TimeSlotInfo slot) {
        return constraints.stream()
            .anyMatch(c -> c.getType() == ConstraintType.ROOM_UNAVAILABLE
                && c.getRoomId() != null && c.getRoomId() == roomId
                && c.matches(slot));
    }

    public List<ConstraintInfo> preferences() {
        return constraints.stream()
            .filter(c -> !c.isHard())
            .collect(Collectors.toUnmodifiableList());
    }

    private void validateReferences() {
        for (OfferingInfo offering : offerings) {
            if (!teachersById.containsKey(offering.getTeacherId())) {
                throw new IllegalArgumentException(String.format(
                    "Offering %d references unknown teacher %d", offering.getId(), offering.getTeacherId()));
            }
            if (!coursesById.containsKey(offering.getCourseId())) {
                throw new IllegalArgumentException(String.format(
                    "Offering %d references unknown course %d", offering.getId(), offering.getCourseId()));
            }
            if (!sectionsById.containsKey(offering.getSectionId())) {
                throw new IllegalArgumentException(String.format(
                    "Offering %d references unknown section %d", offering.getId(), offering.getSectionId()));
            }
        }
        for (ConstraintInfo constraint : constraints) {
            if (constraint.getTimeSlotId() == null && constraint.getDayOfWeek() == null) {
                throw new IllegalArgumentException(
                    "Constraint " + constraint.getId() + " names neither a time slot nor a day");
            }
        }
    }

    private static <T> Map<Long, T> index(Collection<T> items, Function<T, Long> idOf) {
        return items.stream().collect(Collectors.toUnmodifiableMap(idOf, Function.identity()));
    }

    private static <T> T require(Map<Long, T> byId, long id, String kind) {
        T found = byId.get(id);
        if (found == null) {
            throw new IllegalArgumentException(kind + " not found with ID: " + id);
        }
        return found;
    }
}
