package com.example.college_timetable.support;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

import com.example.college_timetable.catalog.CourseInfo;
import com.example.college_timetable.catalog.OfferingInfo;
import com.example.college_timetable.catalog.RoomInfo;
import com.example.college_timetable.catalog.SectionInfo;
import com.example.college_timetable.catalog.TeacherInfo;
import com.example.college_timetable.catalog.TimeSlotInfo;
import com.example.college_timetable.enums.RoomType;

/**
 * Small builders for catalog test data.
 */
public final class TestCatalogs {

    private TestCatalogs() {
    }

    public static TimeSlotInfo slot(long id, DayOfWeek day, int period) {
        return TimeSlotInfo.builder()
            .id(id)
            .dayOfWeek(day)
            .period(period)
            .startTime(LocalTime.of(7 + period, 0))
            .endTime(LocalTime.of(8 + period, 0))
            .build();
    }

    public static TimeSlotInfo breakSlot(long id, DayOfWeek day, int period) {
        return slot(id, day, period).toBuilder().breakSlot(true).build();
    }

    /** {@code days} days from Monday, periods 1..{@code periods}; ids run 1, 2, 3... day by day. */
    public static List<TimeSlotInfo> week(int days, int periods) {
        List<TimeSlotInfo> slots = new ArrayList<>();
        for (int d = 0; d < days; d++) {
            for (int p = 1; p <= periods; p++) {
                slots.add(slot((long) d * periods + p, DayOfWeek.of(d + 1), p));
            }
        }
        return slots;
    }

    public static TeacherInfo teacher(long id, int maxWeeklyLoad) {
        return TeacherInfo.builder()
            .id(id)
            .code("T" + id)
            .name("Teacher " + id)
            .maxWeeklyLoad(maxWeeklyLoad)
            .build();
    }

    public static CourseInfo theoryCourse(long id, int sessionsPerWeek) {
        return CourseInfo.builder()
            .id(id)
            .code("CS" + id)
            .name("Course " + id)
            .creditHours(sessionsPerWeek)
            .sessionsPerWeek(sessionsPerWeek)
            .build();
    }

    public static CourseInfo labCourse(long id, int sessionsPerWeek) {
        return theoryCourse(id, sessionsPerWeek).toBuilder()
            .code("CS" + id + "L")
            .lab(true)
            .sessionDuration(2)
            .build();
    }

    public static SectionInfo section(long id, int studentCount) {
        return SectionInfo.builder()
            .id(id)
            .name("BSCS-1" + (char) ('A' + id - 1))
            .program("BSCS")
            .semester("1")
            .letter(String.valueOf((char) ('A' + id - 1)))
            .studentCount(studentCount)
            .build();
    }

    public static RoomInfo classroom(long id, int capacity) {
        return RoomInfo.builder()
            .id(id)
            .number("R-" + id)
            .roomType(RoomType.CLASSROOM)
            .capacity(capacity)
            .build();
    }

    public static RoomInfo labRoom(long id, int capacity) {
        return RoomInfo.builder()
            .id(id)
            .number("LAB-" + id)
            .roomType(RoomType.LAB)
            .capacity(capacity)
            .build();
    }

    public static OfferingInfo offering(long id, long courseId, long teacherId, long sectionId) {
        return OfferingInfo.builder()
            .id(id)
            .courseId(courseId)
            .teacherId(teacherId)
            .sectionId(sectionId)
            .build();
    }
}
