package com.example.college_timetable.repositories;

import java.util.List;
import java.util.Optional;

import jakarta.persistence.EntityManager;

import org.springframework.stereotype.Repository;

import com.example.college_timetable.entities.TimetableSlot;

@Repository
public class TimetableSlotRepository {
    private final EntityManager entityManager;

    public TimetableSlotRepository(EntityManager entityManager) {
        this.entityManager = entityManager;
    }

    public List<TimetableSlot> findAll() {
        return entityManager
            .createQuery("SELECT ts FROM TimetableSlot ts ORDER BY ts.id", TimetableSlot.class)
            .getResultList();
    }

    public Optional<TimetableSlot> findById(Long id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entityManager.find(TimetableSlot.class, id));
    }

    /** Drops the stored timetable and stores {@code slots} in its place. */
    public List<TimetableSlot> replaceAll(List<TimetableSlot> slots) {
        entityManager.createQuery("DELETE FROM TimetableSlot").executeUpdate();
        slots.forEach(entityManager::persist);
        entityManager.flush();
        return slots;
    }

    public TimetableSlot save(TimetableSlot slot) {
        if (slot.getId() == null) {
            entityManager.persist(slot);
            return slot;
        }
        return entityManager.merge(slot);
    }
}
