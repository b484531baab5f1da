package com.example.college_timetable.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

@Entity
@Getter
@Setter
@Table(name = "course")
public class Course {
    @Id
    @GeneratedValue
    private Long id;

    @Column(name = "course_code", nullable = false, unique = true)
    private String code;

    private String name;

    private int creditHours;

    private int sessionsPerWeek;

    // periods per session; labs take at least two
    private int sessionDuration = 1;

    @Column(name = "is_lab", nullable = false)
    private boolean lab;

    private String program;

    private String semester;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;
}
