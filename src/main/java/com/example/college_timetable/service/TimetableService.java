package com.example.college_timetable.service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import com.example.college_timetable.catalog.Catalog;
import com.example.college_timetable.catalog.TimeSlotInfo;
import com.example.college_timetable.catalog.WeekGrid;
import com.example.college_timetable.config.SolverProperties;
import com.example.college_timetable.edit.TimetableEditor;
import com.example.college_timetable.entities.Offering;
import com.example.college_timetable.entities.TimetableGeneration;
import com.example.college_timetable.entities.TimetableSlot;
import com.example.college_timetable.repositories.CatalogRepository;
import com.example.college_timetable.repositories.TimetableGenerationRepository;
import com.example.college_timetable.repositories.TimetableSlotRepository;
import com.example.college_timetable.solver.Conflict;
import com.example.college_timetable.solver.EngineSettings;
import com.example.college_timetable.solver.GenerationResult;
import com.example.college_timetable.solver.ScheduledSlot;
import com.example.college_timetable.solver.Timetable;
import com.example.college_timetable.solver.TimetableEngine;

import lombok.extern.slf4j.Slf4j;

/**
 * Application-side glue around the engine: loads the catalog, stores what the
 * engine produces and applies validated moves. Generation and moves share one
 * lock, held until their transaction has committed, so a move never sees or
 * writes a half-replaced timetable.
 */
@Slf4j
@Service
public class TimetableService {
    private static final int NOTES_LENGTH = 2000;

    private final CatalogRepository catalogRepository;
    private final TimetableSlotRepository slotRepository;
    private final TimetableGenerationRepository generationRepository;
    private final TimetableEngine engine;
    private final TimetableEditor editor;
    private final SolverProperties solverProperties;
    private final TransactionTemplate transactionTemplate;
    private final ReentrantLock runLock = new ReentrantLock();

    public TimetableService(CatalogRepository catalogRepository, TimetableSlotRepository slotRepository,
                            TimetableGenerationRepository generationRepository, TimetableEngine engine,
                            TimetableEditor editor, SolverProperties solverProperties,
                            PlatformTransactionManager transactionManager) {
        this.catalogRepository = catalogRepository;
        this.slotRepository = slotRepository;
        this.generationRepository = generationRepository;
        this.engine = engine;
        this.editor = editor;
        this.solverProperties = solverProperties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Regenerates the whole timetable. A successful run replaces the stored
     * slots; a failed one leaves them untouched. Every run is recorded.
     *
     * @param timeLimit overrides the configured limit when not null
     */
    public GenerationResult generate(Duration timeLimit) {
        runLock.lock();
        try {
            return transactionTemplate.execute(status -> generateAndStore(timeLimit));
        } finally {
            runLock.unlock();
        }
    }

    /**
     * Moves a stored slot after checking it against the current timetable.
     *
     * @param newRoomId null keeps the current room
     */
    public ScheduledSlot move(long slotId, long newTimeSlotId, Long newRoomId) {
        runLock.lock();
        try {
            return transactionTemplate.execute(status -> moveAndStore(slotId, newTimeSlotId, newRoomId));
        } finally {
            runLock.unlock();
        }
    }

    // true while a generation or a move holds the run lock
    boolean isRunInProgress() {
        return runLock.isLocked();
    }

    private GenerationResult generateAndStore(Duration timeLimit) {
        Catalog catalog = catalogRepository.loadCatalog();
        EngineSettings settings = timeLimit != null
            ? solverProperties.toEngineSettings(timeLimit)
            : solverProperties.toEngineSettings();

        GenerationResult result = engine.generate(catalog, settings,
            (phase, status, statistics) -> log.info("Phase {} finished with {} after {}s",
                phase, status, String.format("%.2f", statistics.getWallTimeSeconds())));

        TimetableGeneration generation = generationRepository.save(toRecord(result));
        if (!result.isSuccess()) {
            log.warn("Generation {} failed: {}", generation.getId(), result.describe());
            return result;
        }

        List<TimetableSlot> stored = slotRepository.replaceAll(toEntities(result.getTimetable(), generation));
        log.info("Generation {} stored {} slots", generation.getId(), stored.size());
        return result.withTimetable(toTimetable(catalog.getTimeSlots(), stored));
    }

    private ScheduledSlot moveAndStore(long slotId, long newTimeSlotId, Long newRoomId) {
        Catalog catalog = catalogRepository.loadCatalog();
        Timetable current = toTimetable(catalogRepository.loadAllTimeSlots(), slotRepository.findAll());
        ScheduledSlot moved = editor.move(catalog, current, slotId, newTimeSlotId, newRoomId);

        TimetableSlot entity = slotRepository.findById(slotId)
            .orElseThrow(() -> new IllegalArgumentException("Timetable slot not found with ID: " + slotId));
        entity.setTimeSlot(catalogRepository.findTimeSlotById(moved.getFirstTimeSlotId())
            .orElseThrow(() -> new IllegalArgumentException("Time slot not found with ID: " + newTimeSlotId)));
        entity.setRoom(catalogRepository.findRoomById(moved.getRoomId())
            .orElseThrow(() -> new IllegalArgumentException("Room not found with ID: " + moved.getRoomId())));
        slotRepository.save(entity);
        return moved;
    }

    @Transactional(readOnly = true)
    public Catalog loadCatalog() {
        return catalogRepository.loadCatalog();
    }

    @Transactional(readOnly = true)
    public Timetable currentTimetable() {
        return toTimetable(catalogRepository.loadAllTimeSlots(), slotRepository.findAll());
    }

    @Transactional(readOnly = true)
    public List<Conflict> checkConflicts() {
        return editor.findConflicts(currentTimetable());
    }

    private List<TimetableSlot> toEntities(Timetable timetable, TimetableGeneration generation) {
        List<TimetableSlot> entities = new ArrayList<>(timetable.size());
        for (ScheduledSlot slot : timetable.getSlots()) {
            TimetableSlot entity = new TimetableSlot();
            entity.setOffering(catalogRepository.findOfferingById(slot.getOfferingId())
                .orElseThrow(() -> new IllegalArgumentException("Offering not found with ID: " + slot.getOfferingId())));
            entity.setSessionIndex(slot.getSessionIndex());
            entity.setTimeSlot(catalogRepository.findTimeSlotById(slot.getFirstTimeSlotId())
                .orElseThrow(() -> new IllegalArgumentException("Time slot not found with ID: " + slot.getFirstTimeSlotId())));
            entity.setBlockLength(slot.getBlockLength());
            entity.setRoom(catalogRepository.findRoomById(slot.getRoomId())
                .orElseThrow(() -> new IllegalArgumentException("Room not found with ID: " + slot.getRoomId())));
            entity.setGeneration(generation);
            entities.add(entity);
        }
        return entities;
    }

    /**
     * Rebuilds the stored timetable from the slot rows themselves, so records
     * whose course, section or time slot has since been deactivated still load.
     */
    static Timetable toTimetable(List<TimeSlotInfo> timeSlots, List<TimetableSlot> entities) {
        WeekGrid grid = new WeekGrid(timeSlots);
        Map<Long, TimeSlotInfo> timeSlotsById = timeSlots.stream()
            .collect(Collectors.toMap(TimeSlotInfo::getId, Function.identity()));

        List<ScheduledSlot> slots = new ArrayList<>(entities.size());
        for (TimetableSlot entity : entities) {
            Offering offering = entity.getOffering();
            TimeSlotInfo start = timeSlotsById.get(entity.getTimeSlot().getId());
            if (start == null) {
                throw new IllegalStateException("Time slot not found with ID: " + entity.getTimeSlot().getId());
            }
            List<TimeSlotInfo> block = grid.span(start, entity.getBlockLength());
            if (block.size() < entity.getBlockLength()) {
                log.warn("Stored slot {} covers only {} of its {} periods from {}",
                    entity.getId(), block.size(), entity.getBlockLength(), start.label());
            }

            slots.add(ScheduledSlot.builder()
                .id(entity.getId())
                .offeringId(offering.getId())
                .courseId(offering.getCourse().getId())
                .teacherId(offering.getTeacher().getId())
                .sectionId(offering.getSection().getId())
                .sessionIndex(entity.getSessionIndex())
                .timeSlotIds(block.stream().map(TimeSlotInfo::getId).collect(Collectors.toUnmodifiableList()))
                .roomId(entity.getRoom().getId())
                .build());
        }
        return new Timetable(slots);
    }

    private static TimetableGeneration toRecord(GenerationResult result) {
        TimetableGeneration generation = new TimetableGeneration();
        generation.setGeneratedAt(LocalDateTime.now());
        generation.setStatus(result.getStatus());
        generation.setSolveStatus(result.getSolveStatus());
        generation.setSlotCount(result.isSuccess() ? result.getTimetable().size() : 0);
        generation.setSolveTimeSeconds(result.getStatistics().getWallTimeSeconds());
        generation.setBranches(result.getStatistics().getBranches());
        generation.setConflicts(result.getStatistics().getConflicts());
        generation.setObjectiveValue(result.getStatistics().getObjectiveValue());
        String notes = result.describe();
        generation.setNotes(notes.length() > NOTES_LENGTH ? notes.substring(0, NOTES_LENGTH) : notes);
        return generation;
    }
}
