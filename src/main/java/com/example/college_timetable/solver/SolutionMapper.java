package com.example.college_timetable.solver;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import com.example.college_timetable.catalog.TimeSlotInfo;
import com.example.college_timetable.exceptions.ConflictDetectedException;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns a solver assignment into scheduled slots and re-checks the result for
 * double bookings before anyone gets to see it.
 */
@Slf4j
public class SolutionMapper {
    private final ConflictChecker conflictChecker;

    public SolutionMapper(ConflictChecker conflictChecker) {
        this.conflictChecker = conflictChecker;
    }

    public Timetable map(TimetableModel model, Assignment assignment) {
        CandidatePool pool = model.getPool();
        List<ScheduledSlot> slots = new ArrayList<>(pool.getInstances().size());
        long nextId = 1;

        for (SessionInstance instance : pool.getInstances()) {
            Candidate chosen = selectedCandidate(pool, instance, assignment);
            slots.add(ScheduledSlot.builder()
                .id(nextId++)
                .offeringId(instance.getOffering().getId())
                .courseId(instance.getOffering().getCourseId())
                .teacherId(instance.getTeacherId())
                .sectionId(instance.getSectionId())
                .sessionIndex(instance.getSessionIndex())
                .timeSlotIds(chosen.getBlock().stream()
                    .map(TimeSlotInfo::getId)
                    .collect(Collectors.toUnmodifiableList()))
                .roomId(chosen.getRoom().getId())
                .build());
        }

        // Integrity sweep: the model should have excluded every clash already
        conflictChecker.findFirstConflict(slots).ifPresent(conflict -> {
            throw new ConflictDetectedException(conflict);
        });

        log.debug("Mapped {} scheduled slots", slots.size());
        return new Timetable(slots);
    }

    private static Candidate selectedCandidate(CandidatePool pool, SessionInstance instance, Assignment assignment) {
        List<Candidate> selected = pool.candidatesFor(instance).stream()
            .filter(assignment::isSelected)
            .collect(Collectors.toList());
        if (selected.size() != 1) {
            throw new IllegalStateException(String.format(
                "Session %s has %d selected placements, expected exactly one", instance.getId(), selected.size()));
        }
        return selected.get(0);
    }
}
