package com.example.college_timetable.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

/**
 * A stored session placement. Multi-period blocks keep their first time slot
 * and their length; the remaining slots follow on the same day.
 */
@Entity
@Getter
@Setter
@Table(name = "timetable_slot")
public class TimetableSlot {
    @Id
    @GeneratedValue
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "offering", referencedColumnName = "id", nullable = false)
    private Offering offering;

    private int sessionIndex;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "time_slot", referencedColumnName = "id", nullable = false)
    private TimeSlot timeSlot;

    @Column(nullable = false)
    private int blockLength;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "room", referencedColumnName = "id", nullable = false)
    private Room room;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "generation", referencedColumnName = "id")
    private TimetableGeneration generation;
}
