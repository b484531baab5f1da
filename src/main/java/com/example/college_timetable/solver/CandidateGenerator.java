package com.example.college_timetable.solver;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.example.college_timetable.catalog.Catalog;
import com.example.college_timetable.catalog.CourseInfo;
import com.example.college_timetable.catalog.OfferingInfo;
import com.example.college_timetable.catalog.RoomInfo;
import com.example.college_timetable.catalog.SectionInfo;
import com.example.college_timetable.catalog.TeacherInfo;
import com.example.college_timetable.catalog.TimeSlotInfo;
import com.example.college_timetable.catalog.WeekGrid;
import com.example.college_timetable.exceptions.InfeasibleCandidateException;

import lombok.extern.slf4j.Slf4j;

/**
 * Expands offerings into session instances and lists, for each instance, every
 * (start slot, room) placement that passes the hard per-session rules: room
 * capacity and type, no breaks, contiguous same-day blocks and the
 * teacher/room unavailability constraints. Fails fast on the first instance
 * that is left without any placement.
 */
@Slf4j
public class CandidateGenerator {

    public CandidatePool generate(Catalog catalog) {
        CandidatePool pool = new CandidatePool();
        WeekGrid grid = catalog.getGrid();
        int nextIndex = 0;

        for (OfferingInfo offering : catalog.getOfferings()) {
            TeacherInfo teacher = catalog.teacher(offering.getTeacherId());
            if (!teacher.isActive()) {
                log.warn("Skipping offering {}: teacher {} is inactive", offering.getId(), teacher.getCode());
                continue;
            }

            CourseInfo course = catalog.course(offering.getCourseId());
            int blockLength = course.blockLength();
            Rejections rejections = new Rejections();
            List<Placement> placements = placementsFor(catalog, grid, offering, course, rejections);

            int sessions = catalog.sessionsPerWeek(offering);
            for (int sessionIndex = 1; sessionIndex <= sessions; sessionIndex++) {
                SessionInstance instance = new SessionInstance(offering, sessionIndex, blockLength);
                if (placements.isEmpty()) {
                    throw new InfeasibleCandidateException(instance.getId(), offering.getId(), rejections.describe());
                }

                List<Candidate> candidates = new ArrayList<>(placements.size());
                for (Placement placement : placements) {
                    candidates.add(new Candidate(nextIndex++, instance, placement.block, placement.room));
                }
                pool.add(instance, candidates);
            }

            log.debug("Offering {} ({} / section {}): {} sessions x {} placements",
                offering.getId(), course.getCode(), offering.getSectionId(), sessions, placements.size());
        }

        log.info("Generated {} session instances with {} candidate placements",
            pool.getInstances().size(), pool.size());
        return pool;
    }

    private List<Placement> placementsFor(Catalog catalog, WeekGrid grid, OfferingInfo offering,
                                          CourseInfo course, Rejections rejections) {
        SectionInfo section = catalog.section(offering.getSectionId());

        List<RoomInfo> suitableRooms = new ArrayList<>();
        for (RoomInfo room : catalog.getRooms()) {
            if (room.getCapacity() < section.getStudentCount()) {
                rejections.capacity++;
            } else if (!room.getRoomType().canHost(course.isLab())) {
                rejections.roomType++;
            } else {
                suitableRooms.add(room);
            }
        }
        rejections.studentCount = section.getStudentCount();
        rejections.totalRooms = catalog.getRooms().size();

        List<Placement> placements = new ArrayList<>();
        if (suitableRooms.isEmpty()) {
            return placements;
        }

        for (TimeSlotInfo start : grid.getTeachableSlots()) {
            Optional<List<TimeSlotInfo>> block = grid.block(start, course.blockLength());
            if (block.isEmpty()) {
                rejections.noBlock++;
                continue;
            }
            if (block.get().stream().anyMatch(slot -> catalog.isTeacherUnavailable(offering.getTeacherId(), slot))) {
                rejections.teacherUnavailable++;
                continue;
            }
            for (RoomInfo room : suitableRooms) {
                if (block.get().stream().anyMatch(slot -> catalog.isRoomUnavailable(room.getId(), slot))) {
                    rejections.roomUnavailable++;
                    continue;
                }
                placements.add(new Placement(block.get(), room));
            }
        }
        rejections.teachableSlots = grid.getTeachableSlots().size();
        rejections.blockLength = course.blockLength();
        return placements;
    }

    private static final class Placement {
        private final List<TimeSlotInfo> block;
        private final RoomInfo room;

        private Placement(List<TimeSlotInfo> block, RoomInfo room) {
            this.block = block;
            this.room = room;
        }
    }

    // counts why placements were pruned, for the failure message
    private static final class Rejections {
        private int totalRooms;
        private int studentCount;
        private int capacity;
        private int roomType;
        private int teachableSlots;
        private int blockLength;
        private int noBlock;
        private int teacherUnavailable;
        private int roomUnavailable;

        private String describe() {
            if (capacity + roomType == totalRooms) {
                return String.format("none of %d rooms fits (%d too small for %d students, %d of the wrong type)",
                    totalRooms, capacity, studentCount, roomType);
            }
            List<String> reasons = new ArrayList<>();
            if (teachableSlots == 0) {
                reasons.add("no teachable time slots");
            }
            if (noBlock > 0) {
                reasons.add(String.format("%d of %d slots cannot start a block of %d consecutive periods",
                    noBlock, teachableSlots, blockLength));
            }
            if (teacherUnavailable > 0) {
                reasons.add(teacherUnavailable + " blocks excluded by teacher unavailability");
            }
            if (roomUnavailable > 0) {
                reasons.add(roomUnavailable + " block/room pairs excluded by room unavailability");
            }
            return String.join("; ", reasons);
        }
    }
}
