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
@Table(name = "teacher")
public class Teacher {
    @Id
    @GeneratedValue
    private Long id;

    @Column(name = "employee_code", nullable = false, unique = true)
    private String code;

    private String name;

    @Column(name = "max_hours_per_week", nullable = false)
    private int maxWeeklyLoad;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;
}
