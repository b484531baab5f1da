package com.example.college_timetable.repositories;

import java.util.List;
import java.util.Optional;

import jakarta.persistence.EntityManager;

import org.springframework.stereotype.Repository;

import com.example.college_timetable.entities.TimetableGeneration;

@Repository
public class TimetableGenerationRepository {
    private final EntityManager entityManager;

    public TimetableGenerationRepository(EntityManager entityManager) {
        this.entityManager = entityManager;
    }

    public TimetableGeneration save(TimetableGeneration generation) {
        entityManager.persist(generation);
        return generation;
    }

    public Optional<TimetableGeneration> findLatest() {
        return entityManager
            .createQuery("SELECT g FROM TimetableGeneration g ORDER BY g.generatedAt DESC, g.id DESC", TimetableGeneration.class)
            .setMaxResults(1)
            .getResultStream()
            .findFirst();
    }

    public List<TimetableGeneration> findAll() {
        return entityManager
            .createQuery("SELECT g FROM TimetableGeneration g ORDER BY g.id", TimetableGeneration.class)
            .getResultList();
    }
}
