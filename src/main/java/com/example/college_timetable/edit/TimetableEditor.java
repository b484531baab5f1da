package com.example.college_timetable.edit;

import java.util.List;
import java.util.stream.Collectors;

import com.example.college_timetable.catalog.Catalog;
import com.example.college_timetable.catalog.CourseInfo;
import com.example.college_timetable.catalog.RoomInfo;
import com.example.college_timetable.catalog.SectionInfo;
import com.example.college_timetable.catalog.TimeSlotInfo;
import com.example.college_timetable.enums.ConflictKind;
import com.example.college_timetable.enums.MoveRule;
import com.example.college_timetable.exceptions.InvalidMoveException;
import com.example.college_timetable.solver.Conflict;
import com.example.college_timetable.solver.ConflictChecker;
import com.example.college_timetable.solver.ScheduledSlot;
import com.example.college_timetable.solver.Timetable;

import lombok.extern.slf4j.Slf4j;

/**
 * Validates hand edits of a generated timetable against the same hard rules the
 * solver enforces. A moved slot keeps its block length; only its start and,
 * optionally, its room change.
 */
@Slf4j
public class TimetableEditor {
    private final ConflictChecker conflictChecker;

    public TimetableEditor(ConflictChecker conflictChecker) {
        this.conflictChecker = conflictChecker;
    }

    /**
     * Checks moving slot {@code slotId} so that it starts at {@code newTimeSlotId}
     * in room {@code newRoomId} ({@code null} keeps the current room).
     *
     * @return the slot as it would look after the move
     * @throws InvalidMoveException naming the first rule the move breaks
     */
    public ScheduledSlot move(Catalog catalog, Timetable timetable, long slotId, long newTimeSlotId, Long newRoomId) {
        ScheduledSlot current = timetable.find(slotId)
            .orElseThrow(() -> new InvalidMoveException(MoveRule.UNKNOWN_SLOT, slotId,
                "Scheduled slot not found with ID: " + slotId));
        if (!catalog.hasCourse(current.getCourseId()) || !catalog.hasSection(current.getSectionId())) {
            throw new InvalidMoveException(MoveRule.INACTIVE_OFFERING, slotId, String.format(
                "Slot %d belongs to course %d / section %d, which is no longer active",
                slotId, current.getCourseId(), current.getSectionId()));
        }

        if (!catalog.hasTimeSlot(newTimeSlotId)) {
            throw new InvalidMoveException(MoveRule.UNKNOWN_TIME_SLOT, slotId,
                "Time slot not found with ID: " + newTimeSlotId);
        }
        long roomId = newRoomId != null ? newRoomId : current.getRoomId();
        if (!catalog.hasRoom(roomId)) {
            throw new InvalidMoveException(MoveRule.UNKNOWN_ROOM, slotId, "Room not found with ID: " + roomId);
        }

        TimeSlotInfo start = catalog.timeSlot(newTimeSlotId);
        RoomInfo room = catalog.room(roomId);
        CourseInfo course = catalog.course(current.getCourseId());
        SectionInfo section = catalog.section(current.getSectionId());

        if (start.isBreakSlot()) {
            throw new InvalidMoveException(MoveRule.BREAK_SLOT, slotId, start.label() + " is a break");
        }
        List<TimeSlotInfo> block = catalog.getGrid().block(start, current.getBlockLength())
            .orElseThrow(() -> new InvalidMoveException(MoveRule.LAB_BLOCK_NOT_CONTIGUOUS, slotId,
                String.format("No %d consecutive teachable periods start at %s", current.getBlockLength(), start.label())));

        if (!room.getRoomType().canHost(course.isLab())) {
            throw new InvalidMoveException(MoveRule.ROOM_TYPE, slotId,
                String.format("Room %s (%s) cannot host %s", room.getNumber(), room.getRoomType(), course.getCode()));
        }
        if (room.getCapacity() < section.getStudentCount()) {
            throw new InvalidMoveException(MoveRule.ROOM_CAPACITY, slotId,
                String.format("Room %s seats %d, section %s has %d students",
                    room.getNumber(), room.getCapacity(), section.getName(), section.getStudentCount()));
        }
        for (TimeSlotInfo slot : block) {
            if (catalog.isTeacherUnavailable(current.getTeacherId(), slot)) {
                throw new InvalidMoveException(MoveRule.TEACHER_UNAVAILABLE, slotId,
                    "Teacher " + catalog.teacher(current.getTeacherId()).getCode() + " is unavailable at " + slot.label());
            }
        }
        for (TimeSlotInfo slot : block) {
            if (catalog.isRoomUnavailable(roomId, slot)) {
                throw new InvalidMoveException(MoveRule.ROOM_UNAVAILABLE, slotId,
                    "Room " + room.getNumber() + " is unavailable at " + slot.label());
            }
        }

        ScheduledSlot moved = current.toBuilder()
            .timeSlotIds(block.stream().map(TimeSlotInfo::getId).collect(Collectors.toUnmodifiableList()))
            .roomId(roomId)
            .build();

        Conflict clash = conflictChecker.firstClash(moved, timetable.others(slotId)).orElse(null);
        if (clash != null) {
            throw new InvalidMoveException(ruleFor(clash.getKind()), slotId, clash.describe());
        }

        log.info("Slot {} moved to {} in room {}", slotId, start.label(), room.getNumber());
        return moved;
    }

    public List<Conflict> findConflicts(Timetable timetable) {
        List<Conflict> conflicts = conflictChecker.findAllConflicts(timetable.getSlots());
        conflicts.forEach(conflict -> log.warn("Conflict: {}", conflict.describe()));
        return conflicts;
    }

    private static MoveRule ruleFor(ConflictKind kind) {
        switch (kind) {
            case ROOM:
                return MoveRule.ROOM_CONFLICT;
            case TEACHER:
                return MoveRule.TEACHER_CONFLICT;
            default:
                return MoveRule.SECTION_CONFLICT;
        }
    }
}
