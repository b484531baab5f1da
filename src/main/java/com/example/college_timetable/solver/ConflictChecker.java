package com.example.college_timetable.solver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.example.college_timetable.enums.ConflictKind;

/**
 * Finds teacher, room and section double bookings among scheduled slots.
 * Room clashes are reported before teacher clashes, teacher before section.
 */
public class ConflictChecker {
    private static final ConflictKind[] CHECK_ORDER = {ConflictKind.ROOM, ConflictKind.TEACHER, ConflictKind.SECTION};

    public List<Conflict> findAllConflicts(Collection<ScheduledSlot> slots) {
        List<Conflict> conflicts = new ArrayList<>();
        for (ConflictKind kind : CHECK_ORDER) {
            Map<String, ScheduledSlot> occupants = new HashMap<>();
            for (ScheduledSlot slot : slots) {
                long resourceId = resourceOf(kind, slot);
                for (Long timeSlotId : slot.getTimeSlotIds()) {
                    ScheduledSlot previous = occupants.putIfAbsent(resourceId + "_" + timeSlotId, slot);
                    if (previous != null && previous.getId() != slot.getId()) {
                        conflicts.add(new Conflict(kind, resourceId, timeSlotId, previous.getId(), slot.getId()));
                    }
                }
            }
        }
        return conflicts;
    }

    public Optional<Conflict> findFirstConflict(Collection<ScheduledSlot> slots) {
        List<Conflict> conflicts = findAllConflicts(slots);
        return conflicts.isEmpty() ? Optional.empty() : Optional.of(conflicts.get(0));
    }

    /**
     * The first clash between {@code candidate} and any of {@code others}. Slots
     * sharing the candidate's id are ignored.
     */
    public Optional<Conflict> firstClash(ScheduledSlot candidate, Collection<ScheduledSlot> others) {
        for (ConflictKind kind : CHECK_ORDER) {
            long resourceId = resourceOf(kind, candidate);
            for (ScheduledSlot other : others) {
                if (other.getId() == candidate.getId() || resourceOf(kind, other) != resourceId) {
                    continue;
                }
                for (Long timeSlotId : candidate.getTimeSlotIds()) {
                    if (other.occupies(timeSlotId)) {
                        return Optional.of(new Conflict(kind, resourceId, timeSlotId, other.getId(), candidate.getId()));
                    }
                }
            }
        }
        return Optional.empty();
    }

    private static long resourceOf(ConflictKind kind, ScheduledSlot slot) {
        switch (kind) {
            case ROOM:
                return slot.getRoomId();
            case TEACHER:
                return slot.getTeacherId();
            case SECTION:
                return slot.getSectionId();
            default:
                throw new IllegalArgumentException("Unknown conflict kind: " + kind);
        }
    }
}
