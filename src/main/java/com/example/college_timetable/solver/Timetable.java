package com.example.college_timetable.solver;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * An immutable, ordered set of scheduled slots. Edits produce a new instance.
 */
public class Timetable {
    private final List<ScheduledSlot> slots;

    public Timetable(List<ScheduledSlot> slots) {
        this.slots = List.copyOf(slots);
    }

    public static Timetable empty() {
        return new Timetable(List.of());
    }

    public List<ScheduledSlot> getSlots() {
        return slots;
    }

    public int size() {
        return slots.size();
    }

    public Optional<ScheduledSlot> find(long slotId) {
        return slots.stream().filter(slot -> slot.getId() == slotId).findFirst();
    }

    /** Every slot except the given one. */
    public List<ScheduledSlot> others(long slotId) {
        return slots.stream()
            .filter(slot -> slot.getId() != slotId)
            .collect(Collectors.toUnmodifiableList());
    }

    public Timetable withReplaced(ScheduledSlot replacement) {
        List<ScheduledSlot> updated = new ArrayList<>(slots.size());
        boolean found = false;
        for (ScheduledSlot slot : slots) {
            if (slot.getId() == replacement.getId()) {
                updated.add(replacement);
                found = true;
            } else {
                updated.add(slot);
            }
        }
        if (!found) {
            throw new IllegalArgumentException("Scheduled slot not found with ID: " + replacement.getId());
        }
        return new Timetable(updated);
    }

    /** Periods taught per week by one teacher. */
    public int teachingPeriods(long teacherId) {
        return slots.stream()
            .filter(slot -> slot.getTeacherId() == teacherId)
            .mapToInt(ScheduledSlot::getBlockLength)
            .sum();
    }
}
