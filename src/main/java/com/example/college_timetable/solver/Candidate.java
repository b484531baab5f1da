package com.example.college_timetable.solver;

import java.util.List;

import com.example.college_timetable.catalog.RoomInfo;
import com.example.college_timetable.catalog.TimeSlotInfo;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A legal placement of one session instance: a block of consecutive time slots
 * (a single slot for theory sessions) in one room. The index is unique within a
 * {@link CandidatePool} and doubles as the decision variable's position.
 */
@Getter
@ToString(of = {"index", "instance", "room"})
@EqualsAndHashCode(of = "index")
public class Candidate {
    private final int index;
    private final SessionInstance instance;
    private final List<TimeSlotInfo> block;
    private final RoomInfo room;

    public Candidate(int index, SessionInstance instance, List<TimeSlotInfo> block, RoomInfo room) {
        this.index = index;
        this.instance = instance;
        this.block = List.copyOf(block);
        this.room = room;
    }

    public TimeSlotInfo getStart() {
        return block.get(0);
    }

    public boolean covers(TimeSlotInfo slot) {
        return block.contains(slot);
    }
}
