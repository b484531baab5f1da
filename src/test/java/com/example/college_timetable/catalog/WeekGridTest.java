package com.example.college_timetable.catalog;

import static com.example.college_timetable.support.TestCatalogs.breakSlot;
import static com.example.college_timetable.support.TestCatalogs.slot;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.DayOfWeek;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class WeekGridTest {

    private final TimeSlotInfo mon1 = slot(1, DayOfWeek.MONDAY, 1);
    private final TimeSlotInfo mon2 = slot(2, DayOfWeek.MONDAY, 2);
    private final TimeSlotInfo monBreak = breakSlot(3, DayOfWeek.MONDAY, 3);
    private final TimeSlotInfo mon4 = slot(4, DayOfWeek.MONDAY, 4);
    private final TimeSlotInfo mon6 = slot(6, DayOfWeek.MONDAY, 6);
    private final TimeSlotInfo tue1 = slot(11, DayOfWeek.TUESDAY, 1);

    private final WeekGrid grid = new WeekGrid(List.of(tue1, mon6, mon4, monBreak, mon2, mon1));

    @Test
    @DisplayName("teachable slots skip breaks and are ordered by day then period")
    void teachableSlots() {
        assertThat(grid.getTeachableSlots()).containsExactly(mon1, mon2, mon4, mon6, tue1);
        assertThat(grid.getTeachingDays()).containsExactly(DayOfWeek.MONDAY, DayOfWeek.TUESDAY);
    }

    @Test
    @DisplayName("a block is consecutive periods on one day")
    void blockOfConsecutivePeriods() {
        assertThat(grid.block(mon1, 2)).contains(List.of(mon1, mon2));
        assertThat(grid.block(mon1, 1)).contains(List.of(mon1));
    }

    @Test
    @DisplayName("blocks never cross a break, a gap in periods or the end of the day")
    void blockRejectsBreaksAndGaps() {
        assertThat(grid.block(mon2, 2)).isEmpty();
        assertThat(grid.block(mon4, 2)).isEmpty();
        assertThat(grid.block(mon6, 2)).isEmpty();
        assertThat(grid.block(monBreak, 1)).isEmpty();
    }

    @Test
    @DisplayName("edge periods are the first and last teachable slots of each day")
    void edgePeriods() {
        assertThat(grid.isEdgePeriod(mon1)).isTrue();
        assertThat(grid.isEdgePeriod(mon6)).isTrue();
        assertThat(grid.isEdgePeriod(mon2)).isFalse();
        assertThat(grid.isEdgePeriod(mon4)).isFalse();
        assertThat(grid.isEdgePeriod(tue1)).isTrue();
    }

    @Test
    @DisplayName("a span follows consecutive periods through breaks and stops at a gap")
    void span() {
        assertThat(grid.span(mon2, 3)).containsExactly(mon2, monBreak, mon4);
        assertThat(grid.span(mon4, 3)).containsExactly(mon4);
        assertThat(grid.span(tue1, 1)).containsExactly(tue1);
    }
}
