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
@Table(name = "section")
public class Section {
    @Id
    @GeneratedValue
    private Long id;

    private String name;

    private String program;

    private String semester;

    @Column(name = "section_letter")
    private String letter;

    private int studentCount;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;
}
