package com.example.college_timetable.solver;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.college_timetable.enums.ConflictKind;

class ConflictCheckerTest {

    private final ConflictChecker checker = new ConflictChecker();

    private static ScheduledSlot slot(long id, long teacherId, long sectionId, long roomId, Long... timeSlotIds) {
        return ScheduledSlot.builder()
            .id(id)
            .offeringId(id)
            .courseId(1)
            .teacherId(teacherId)
            .sectionId(sectionId)
            .sessionIndex(1)
            .timeSlotIds(List.of(timeSlotIds))
            .roomId(roomId)
            .build();
    }

    @Test
    @DisplayName("disjoint slots have no conflicts")
    void noConflicts() {
        List<ScheduledSlot> slots = List.of(slot(1, 1, 1, 1, 1L), slot(2, 1, 1, 1, 2L, 3L));

        assertThat(checker.findAllConflicts(slots)).isEmpty();
        assertThat(checker.findFirstConflict(slots)).isEmpty();
    }

    @Test
    @DisplayName("a lab block clashes on any of its periods")
    void labBlockOverlap() {
        List<ScheduledSlot> slots = List.of(slot(1, 1, 1, 1, 2L, 3L), slot(2, 2, 2, 2, 3L));

        assertThat(checker.findAllConflicts(slots)).isEmpty();

        List<ScheduledSlot> sameRoom = List.of(slot(1, 1, 1, 1, 2L, 3L), slot(2, 2, 2, 1, 3L));
        assertThat(checker.findAllConflicts(sameRoom)).singleElement()
            .satisfies(conflict -> {
                assertThat(conflict.getKind()).isEqualTo(ConflictKind.ROOM);
                assertThat(conflict.getTimeSlotId()).isEqualTo(3L);
            });
    }

    @Test
    @DisplayName("every shared resource is reported, rooms first")
    void allKinds() {
        List<ScheduledSlot> slots = List.of(slot(1, 1, 1, 1, 1L), slot(2, 1, 1, 1, 1L));

        assertThat(checker.findAllConflicts(slots)).extracting(Conflict::getKind)
            .containsExactly(ConflictKind.ROOM, ConflictKind.TEACHER, ConflictKind.SECTION);
        assertThat(checker.findFirstConflict(slots).map(Conflict::describe))
            .contains("ROOM 1 double-booked at time slot 1 by slots 1 and 2");
    }

    @Test
    @DisplayName("a slot never clashes with itself")
    void ignoresSameSlot() {
        ScheduledSlot moved = slot(1, 1, 1, 1, 1L);

        assertThat(checker.firstClash(moved, List.of(slot(1, 1, 1, 1, 1L)))).isEmpty();
        assertThat(checker.firstClash(moved, List.of(slot(2, 5, 1, 9, 1L))))
            .hasValueSatisfying(conflict -> assertThat(conflict.getKind()).isEqualTo(ConflictKind.SECTION));
    }
}
