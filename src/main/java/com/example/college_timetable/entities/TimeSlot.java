package com.example.college_timetable.entities;

import java.time.DayOfWeek;
import java.time.LocalTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

@Entity
@Getter
@Setter
@Table(name = "time_slot",
      uniqueConstraints = {@UniqueConstraint(columnNames = {"day_of_week", "period_number"})})
public class TimeSlot {
    @Id
    @GeneratedValue
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", nullable = false)
    private DayOfWeek dayOfWeek;

    @Column(name = "period_number", nullable = false)
    private int period;

    private LocalTime startTime;

    private LocalTime endTime;

    @Column(name = "is_break", nullable = false)
    private boolean breakSlot;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;
}
