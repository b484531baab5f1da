package com.example.college_timetable;

import java.time.DayOfWeek;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.example.college_timetable.catalog.Catalog;
import com.example.college_timetable.catalog.ConstraintInfo;
import com.example.college_timetable.catalog.CourseInfo;
import com.example.college_timetable.catalog.OfferingInfo;
import com.example.college_timetable.catalog.SectionInfo;
import com.example.college_timetable.catalog.TimeSlotInfo;
import com.example.college_timetable.solver.ScheduledSlot;
import com.example.college_timetable.solver.Timetable;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes the catalog and a generated timetable to the log for inspection.
 */
@Slf4j
@Component
public class TimetableReport {

    public void logCatalog(Catalog catalog) {
        log.info("=== Offerings ===");
        for (OfferingInfo offering : catalog.getOfferings()) {
            CourseInfo course = catalog.course(offering.getCourseId());
            log.info("Offering ID: {} | Course: {} ({}) | Teacher: {} | Section: {} | Sessions: {} x {} period(s)",
                offering.getId(),
                course.getCode(),
                course.isLab() ? "lab" : "theory",
                catalog.teacher(offering.getTeacherId()).getCode(),
                catalog.section(offering.getSectionId()).getName(),
                catalog.sessionsPerWeek(offering),
                course.blockLength());
        }

        log.info("=== Teachers ===");
        catalog.getTeachers().forEach(teacher -> log.info("Teacher ID: {} | {} | max load {}{}",
            teacher.getId(), teacher.getCode(), teacher.getMaxWeeklyLoad(), teacher.isActive() ? "" : " | inactive"));

        log.info("=== Rooms ===");
        catalog.getRooms().forEach(room -> log.info("Room ID: {} | {} | {} | capacity {}",
            room.getId(), room.getNumber(), room.getRoomType(), room.getCapacity()));

        log.info("=== Time slots ===");
        for (DayOfWeek day : catalog.getGrid().getTeachingDays()) {
            log.info("{}: {}", day, catalog.getGrid().slotsOn(day).stream()
                .map(slot -> slot.getPeriod() + (slot.isBreakSlot() ? "(break)" : ""))
                .collect(Collectors.joining(" ")));
        }

        log.info("=== Constraints ===");
        for (ConstraintInfo constraint : catalog.getConstraints()) {
            log.info("Constraint ID: {} | {} | teacher {} | room {} | section {} | slot {} | day {} | period {} | weight {}",
                constraint.getId(), constraint.getType(), constraint.getTeacherId(), constraint.getRoomId(),
                constraint.getSectionId(), constraint.getTimeSlotId(), constraint.getDayOfWeek(),
                constraint.getPeriod(), constraint.getWeight());
        }
    }

    /** One block per section, one line per day. */
    public void logTimetable(Catalog catalog, Timetable timetable) {
        for (SectionInfo section : catalog.getSections()) {
            List<ScheduledSlot> sectionSlots = timetable.getSlots().stream()
                .filter(slot -> slot.getSectionId() == section.getId())
                .collect(Collectors.toList());
            if (sectionSlots.isEmpty()) {
                continue;
            }
            log.info("=== Section {} ===", section.getName());
            for (DayOfWeek day : catalog.getGrid().getTeachingDays()) {
                String line = catalog.getGrid().slotsOn(day).stream()
                    .map(timeSlot -> cell(catalog, sectionSlots, timeSlot))
                    .collect(Collectors.joining(" | "));
                log.info("{} | {}", day, line);
            }
        }
    }

    private static String cell(Catalog catalog, List<ScheduledSlot> sectionSlots, TimeSlotInfo timeSlot) {
        if (timeSlot.isBreakSlot()) {
            return "BREAK";
        }
        return sectionSlots.stream()
            .filter(slot -> slot.occupies(timeSlot.getId()))
            .findFirst()
            .map(slot -> catalog.course(slot.getCourseId()).getCode() + "@" + catalog.room(slot.getRoomId()).getNumber())
            .orElse("-");
    }
}
