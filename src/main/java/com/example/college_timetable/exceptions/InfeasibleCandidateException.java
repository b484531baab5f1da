package com.example.college_timetable.exceptions;

import lombok.Getter;

/**
 * A session instance has no legal (time slot, room) placement at all. Raised
 * before the solver runs; the data or the constraints have to change first.
 */
@Getter
public class InfeasibleCandidateException extends TimetableException {
    private final String instanceId;
    private final long offeringId;
    private final String reason;

    public InfeasibleCandidateException(String instanceId, long offeringId, String reason) {
        super(String.format("No legal placement for session %s (offering %d): %s", instanceId, offeringId, reason));
        this.instanceId = instanceId;
        this.offeringId = offeringId;
        this.reason = reason;
    }
}
