package com.example.college_timetable.entities;

import java.time.DayOfWeek;

import com.example.college_timetable.enums.ConstraintType;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

/**
 * Admin-entered rule. Targets one time slot, or a day and optional period number
 * when the time slot is empty.
 */
@Entity
@Getter
@Setter
@Table(name = "scheduling_constraint")
public class SchedulingConstraint {
    @Id
    @GeneratedValue
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "constraint_type", nullable = false)
    private ConstraintType type;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "teacher", referencedColumnName = "id")
    private Teacher teacher;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "room", referencedColumnName = "id")
    private Room room;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "section", referencedColumnName = "id")
    private Section section;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "time_slot", referencedColumnName = "id")
    private TimeSlot timeSlot;

    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week")
    private DayOfWeek dayOfWeek;

    @Column(name = "period_number")
    private Integer period;

    private int weight = 1;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;
}
