package com.example.college_timetable.catalog;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Time slots arranged by day and period. Answers the questions the engine asks
 * about the shape of the week: which slots can be taught in, which runs of
 * slots form a contiguous block, and which periods sit at the edge of a day.
 */
public class WeekGrid {
    private static final Comparator<TimeSlotInfo> BY_DAY_AND_PERIOD =
        Comparator.comparing(TimeSlotInfo::getDayOfWeek).thenComparingInt(TimeSlotInfo::getPeriod);

    private final Map<DayOfWeek, List<TimeSlotInfo>> slotsByDay = new EnumMap<>(DayOfWeek.class);
    private final List<TimeSlotInfo> teachableSlots;

    public WeekGrid(List<TimeSlotInfo> timeSlots) {
        for (TimeSlotInfo slot : timeSlots) {
            slotsByDay.computeIfAbsent(slot.getDayOfWeek(), k -> new ArrayList<>()).add(slot);
        }
        slotsByDay.values().forEach(daySlots -> daySlots.sort(BY_DAY_AND_PERIOD));

        this.teachableSlots = timeSlots.stream()
            .filter(slot -> !slot.isBreakSlot())
            .sorted(BY_DAY_AND_PERIOD)
            .collect(Collectors.toUnmodifiableList());
    }

    public List<TimeSlotInfo> getTeachableSlots() {
        return teachableSlots;
    }

    /** Days with at least one non-break slot, Monday first. */
    public List<DayOfWeek> getTeachingDays() {
        return teachableSlots.stream()
            .map(TimeSlotInfo::getDayOfWeek)
            .distinct()
            .collect(Collectors.toUnmodifiableList());
    }

    public List<TimeSlotInfo> slotsOn(DayOfWeek day) {
        return Collections.unmodifiableList(slotsByDay.getOrDefault(day, List.of()));
    }

    /**
     * The {@code length} slots starting at {@code start}, provided they all fall on
     * the same day, carry consecutive period numbers and none of them is a break.
     */
    public Optional<List<TimeSlotInfo>> block(TimeSlotInfo start, int length) {
        if (start.isBreakSlot() || length < 1) {
            return Optional.empty();
        }
        List<TimeSlotInfo> daySlots = slotsByDay.getOrDefault(start.getDayOfWeek(), List.of());
        int index = daySlots.indexOf(start);
        if (index < 0 || index + length > daySlots.size()) {
            return Optional.empty();
        }

        List<TimeSlotInfo> block = new ArrayList<>(length);
        for (int k = 0; k < length; k++) {
            TimeSlotInfo slot = daySlots.get(index + k);
            if (slot.isBreakSlot() || slot.getPeriod() != start.getPeriod() + k) {
                return Optional.empty();
            }
            block.add(slot);
        }
        return Optional.of(Collections.unmodifiableList(block));
    }

    /**
     * The slots of {@code start}'s day numbered {@code start.period} up to
     * {@code start.period + length - 1}, stopping at the first missing period.
     * Unlike {@link #block} it ignores break flags, so it can still place a block
     * stored before the grid changed.
     */
    public List<TimeSlotInfo> span(TimeSlotInfo start, int length) {
        List<TimeSlotInfo> span = new ArrayList<>(length);
        span.add(start);
        for (TimeSlotInfo slot : slotsByDay.getOrDefault(start.getDayOfWeek(), List.of())) {
            int offset = slot.getPeriod() - start.getPeriod();
            if (offset == span.size() && offset < length) {
                span.add(slot);
            }
        }
        return Collections.unmodifiableList(span);
    }

    /** True when the slot is the first or the last teachable period of its day. */
    public boolean isEdgePeriod(TimeSlotInfo slot) {
        List<TimeSlotInfo> teachable = slotsByDay.getOrDefault(slot.getDayOfWeek(), List.of()).stream()
            .filter(s -> !s.isBreakSlot())
            .collect(Collectors.toList());
        if (teachable.isEmpty()) {
            return false;
        }
        return teachable.get(0).equals(slot) || teachable.get(teachable.size() - 1).equals(slot);
    }
}
