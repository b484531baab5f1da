package com.example.college_timetable.entities;

import java.time.LocalDateTime;

import com.example.college_timetable.enums.GenerationStatus;
import com.example.college_timetable.enums.SolveStatus;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

/**
 * Audit record of one generation run.
 */
@Entity
@Getter
@Setter
@Table(name = "timetable_generation")
public class TimetableGeneration {
    @Id
    @GeneratedValue
    private Long id;

    @Column(nullable = false)
    private LocalDateTime generatedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "generation_status", nullable = false)
    private GenerationStatus status;

    @Enumerated(EnumType.STRING)
    private SolveStatus solveStatus;

    private int slotCount;

    private double solveTimeSeconds;

    private long branches;

    private long conflicts;

    private Double objectiveValue;

    @Column(length = 2000)
    private String notes;
}
