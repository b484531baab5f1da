package com.example.college_timetable.solver;

import com.example.college_timetable.catalog.OfferingInfo;

import lombok.Value;

/**
 * One weekly session an offering needs. An offering with four sessions per
 * week expands into four instances, numbered from 1.
 */
@Value
public class SessionInstance {
    String id;
    OfferingInfo offering;
    int sessionIndex;
    int blockLength;

    public SessionInstance(OfferingInfo offering, int sessionIndex, int blockLength) {
        this.id = "O" + offering.getId() + "-S" + sessionIndex;
        this.offering = offering;
        this.sessionIndex = sessionIndex;
        this.blockLength = blockLength;
    }

    public long getTeacherId() {
        return offering.getTeacherId();
    }

    public long getSectionId() {
        return offering.getSectionId();
    }

    public boolean isMultiPeriod() {
        return blockLength > 1;
    }
}
