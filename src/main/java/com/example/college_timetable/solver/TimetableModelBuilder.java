package com.example.college_timetable.solver;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.example.college_timetable.catalog.Catalog;
import com.example.college_timetable.catalog.ConstraintInfo;
import com.example.college_timetable.catalog.TeacherInfo;
import com.example.college_timetable.catalog.TimeSlotInfo;
import com.example.college_timetable.catalog.WeekGrid;
import com.example.college_timetable.enums.ConstraintType;
import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.LinearExprBuilder;
import com.google.ortools.sat.Literal;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns a {@link CandidatePool} into a CP-SAT model. Every candidate becomes a
 * boolean; the hard rules are exactly-one placement per session, no
 * double-booking of teachers, rooms or sections in any covered slot, and the
 * teachers' weekly load. The soft terms are gathered into one minimised sum.
 */
@Slf4j
public class TimetableModelBuilder {

    public TimetableModel build(Catalog catalog, CandidatePool pool, ObjectiveWeights weights) {
        OrToolsNatives.ensureLoaded();
        CpModel model = new CpModel();
        BoolVar[] decisions = createDecisionVariables(model, pool);

        enforceSinglePlacement(model, pool, decisions);
        enforceNoDoubleBooking(model, pool, decisions);
        enforceWeeklyLoad(model, catalog, pool, decisions);
        orderInterchangeableSessions(model, catalog.getGrid(), pool, decisions);

        LinearExprBuilder objective = LinearExpr.newBuilder();
        int terms = 0;
        terms += addEdgePeriodPenalty(objective, catalog.getGrid(), pool, decisions, weights.getEdgePeriodPenalty());
        terms += addDailyBalancePenalty(model, objective, catalog.getGrid(), pool, decisions, weights.getDailyBalancePenalty());
        terms += addSameDayRepeatPenalty(model, objective, catalog.getGrid(), pool, decisions, weights.getSameDayRepeatPenalty());
        terms += addPreferenceRewards(objective, catalog, pool, decisions, weights.getPreferenceScale());

        log.info("Built model with {} decision variables and {} objective terms", decisions.length, terms);
        return new TimetableModel(model, pool, decisions, objective.build(), terms);
    }

    private BoolVar[] createDecisionVariables(CpModel model, CandidatePool pool) {
        BoolVar[] decisions = new BoolVar[pool.size()];
        for (Candidate candidate : pool.getAllCandidates()) {
            decisions[candidate.getIndex()] = model.newBoolVar(String.format("place_%s_slot%d_room%d",
                candidate.getInstance().getId(), candidate.getStart().getId(), candidate.getRoom().getId()));
        }
        return decisions;
    }

    //HARD CONSTRAINTS
    //Constraint 1: every session instance takes exactly one of its candidate placements
    private void enforceSinglePlacement(CpModel model, CandidatePool pool, BoolVar[] decisions) {
        for (SessionInstance instance : pool.getInstances()) {
            model.addExactlyOne(literalsOf(pool.candidatesFor(instance), decisions));
        }
    }

    //Constraint 2: a teacher, a room and a section each hold at most one session per time slot.
    //A multi-period block occupies every slot it covers.
    private void enforceNoDoubleBooking(CpModel model, CandidatePool pool, BoolVar[] decisions) {
        Map<String, List<Literal>> occupancy = new LinkedHashMap<>();

        for (Candidate candidate : pool.getAllCandidates()) {
            BoolVar placed = decisions[candidate.getIndex()];
            SessionInstance instance = candidate.getInstance();
            for (TimeSlotInfo slot : candidate.getBlock()) {
                occupancy.computeIfAbsent("teacher_" + instance.getTeacherId() + "_slot_" + slot.getId(),
                    k -> new ArrayList<>()).add(placed);
                occupancy.computeIfAbsent("room_" + candidate.getRoom().getId() + "_slot_" + slot.getId(),
                    k -> new ArrayList<>()).add(placed);
                occupancy.computeIfAbsent("section_" + instance.getSectionId() + "_slot_" + slot.getId(),
                    k -> new ArrayList<>()).add(placed);
            }
        }

        int constraintsAdded = 0;
        for (List<Literal> placements : occupancy.values()) {
            if (placements.size() > 1) {
                model.addAtMostOne(placements.toArray(new Literal[0]));
                constraintsAdded++;
            }
        }
        log.debug("Added {} no-double-booking constraints", constraintsAdded);
    }

    //Constraint 3: scheduled periods per teacher stay within the weekly load
    private void enforceWeeklyLoad(CpModel model, Catalog catalog, CandidatePool pool, BoolVar[] decisions) {
        Map<Long, List<Candidate>> candidatesByTeacher = pool.getAllCandidates().stream()
            .collect(Collectors.groupingBy(c -> c.getInstance().getTeacherId()));

        for (Map.Entry<Long, List<Candidate>> entry : candidatesByTeacher.entrySet()) {
            TeacherInfo teacher = catalog.teacher(entry.getKey());
            LinearExprBuilder load = LinearExpr.newBuilder();
            for (Candidate candidate : entry.getValue()) {
                load.addTerm(decisions[candidate.getIndex()], candidate.getInstance().getBlockLength());
            }
            model.addLessOrEqual(load.build(), teacher.getMaxWeeklyLoad());
        }
    }

    // Sessions of one offering are interchangeable, so session k must start before session k+1.
    private void orderInterchangeableSessions(CpModel model, WeekGrid grid, CandidatePool pool, BoolVar[] decisions) {
        Map<Long, List<SessionInstance>> sessionsByOffering = pool.getInstances().stream()
            .collect(Collectors.groupingBy(i -> i.getOffering().getId(), LinkedHashMap::new, Collectors.toList()));
        Map<TimeSlotInfo, Integer> ordinal = new HashMap<>();
        List<TimeSlotInfo> teachable = grid.getTeachableSlots();
        for (int i = 0; i < teachable.size(); i++) {
            ordinal.put(teachable.get(i), i);
        }

        for (List<SessionInstance> sessions : sessionsByOffering.values()) {
            for (int k = 0; k + 1 < sessions.size(); k++) {
                LinearExprBuilder gap = LinearExpr.newBuilder();
                for (Candidate candidate : pool.candidatesFor(sessions.get(k))) {
                    gap.addTerm(decisions[candidate.getIndex()], ordinal.get(candidate.getStart()));
                }
                for (Candidate candidate : pool.candidatesFor(sessions.get(k + 1))) {
                    gap.addTerm(decisions[candidate.getIndex()], -ordinal.get(candidate.getStart()));
                }
                model.addLessOrEqual(gap.build(), -1);
            }
        }
    }

    //SOFT CONSTRAINTS
    private int addEdgePeriodPenalty(LinearExprBuilder objective, WeekGrid grid, CandidatePool pool,
                                     BoolVar[] decisions, long weight) {
        if (weight == 0) {
            return 0;
        }
        int terms = 0;
        for (Candidate candidate : pool.getAllCandidates()) {
            if (candidate.getBlock().stream().anyMatch(grid::isEdgePeriod)) {
                objective.addTerm(decisions[candidate.getIndex()], weight);
                terms++;
            }
        }
        log.debug("Added edge-of-day penalty on {} placements", terms);
        return terms;
    }

    // Penalises the pairwise spread between a section's daily period counts.
    private int addDailyBalancePenalty(CpModel model, LinearExprBuilder objective, WeekGrid grid,
                                       CandidatePool pool, BoolVar[] decisions, long weight) {
        List<DayOfWeek> days = grid.getTeachingDays();
        if (weight == 0 || days.size() < 2) {
            return 0;
        }
        Map<Long, List<Candidate>> candidatesBySection = pool.getAllCandidates().stream()
            .collect(Collectors.groupingBy(c -> c.getInstance().getSectionId(), LinkedHashMap::new, Collectors.toList()));

        int terms = 0;
        for (Map.Entry<Long, List<Candidate>> entry : candidatesBySection.entrySet()) {
            long sectionId = entry.getKey();
            int totalPeriods = pool.getInstances().stream()
                .filter(i -> i.getSectionId() == sectionId)
                .mapToInt(SessionInstance::getBlockLength)
                .sum();
            if (totalPeriods < 2) {
                continue;
            }

            List<IntVar> dailyLoads = new ArrayList<>();
            for (DayOfWeek day : days) {
                IntVar dailyLoad = model.newIntVar(0, totalPeriods, "section_" + sectionId + "_periods_" + day);
                LinearExprBuilder sum = LinearExpr.newBuilder();
                for (Candidate candidate : entry.getValue()) {
                    if (candidate.getStart().getDayOfWeek() == day) {
                        sum.addTerm(decisions[candidate.getIndex()], candidate.getInstance().getBlockLength());
                    }
                }
                model.addEquality(dailyLoad, sum.build());
                dailyLoads.add(dailyLoad);
            }

            for (int i = 0; i < dailyLoads.size(); i++) {
                for (int j = i + 1; j < dailyLoads.size(); j++) {
                    IntVar diff = model.newIntVar(-totalPeriods, totalPeriods,
                        String.format("section_%d_diff_%d_%d", sectionId, i, j));
                    model.addEquality(diff, LinearExpr.newBuilder()
                        .add(dailyLoads.get(i))
                        .addTerm(dailyLoads.get(j), -1)
                        .build());
                    IntVar spread = model.newIntVar(0, totalPeriods,
                        String.format("section_%d_spread_%d_%d", sectionId, i, j));
                    model.addAbsEquality(spread, diff);
                    objective.addTerm(spread, weight);
                    terms++;
                }
            }
        }
        log.debug("Added daily balance penalty with {} spread variables", terms);
        return terms;
    }

    // Penalises every session of an offering beyond the first on the same day.
    private int addSameDayRepeatPenalty(CpModel model, LinearExprBuilder objective, WeekGrid grid,
                                        CandidatePool pool, BoolVar[] decisions, long weight) {
        if (weight == 0) {
            return 0;
        }
        Map<Long, List<SessionInstance>> sessionsByOffering = pool.getInstances().stream()
            .collect(Collectors.groupingBy(i -> i.getOffering().getId(), LinkedHashMap::new, Collectors.toList()));

        int terms = 0;
        for (Map.Entry<Long, List<SessionInstance>> entry : sessionsByOffering.entrySet()) {
            List<SessionInstance> sessions = entry.getValue();
            if (sessions.size() < 2) {
                continue;
            }
            for (DayOfWeek day : grid.getTeachingDays()) {
                IntVar excess = model.newIntVar(0, sessions.size() - 1,
                    "offering_" + entry.getKey() + "_repeats_" + day);
                // excess >= sessionsOnDay - 1
                LinearExprBuilder bound = LinearExpr.newBuilder().add(excess);
                for (SessionInstance session : sessions) {
                    for (Candidate candidate : pool.candidatesFor(session)) {
                        if (candidate.getStart().getDayOfWeek() == day) {
                            bound.addTerm(decisions[candidate.getIndex()], -1);
                        }
                    }
                }
                model.addGreaterOrEqual(bound.build(), -1);
                objective.addTerm(excess, weight);
                terms++;
            }
        }
        return terms;
    }

    // Preference weights are rewards, so they enter the minimised sum negated.
    private int addPreferenceRewards(LinearExprBuilder objective, Catalog catalog, CandidatePool pool,
                                     BoolVar[] decisions, long scale) {
        if (scale == 0) {
            return 0;
        }
        int terms = 0;
        for (ConstraintInfo preference : catalog.preferences()) {
            for (Candidate candidate : pool.getAllCandidates()) {
                if (preference.getType() == ConstraintType.SECTION_PREFERENCE
                    && (preference.getSectionId() == null
                        || preference.getSectionId() != candidate.getInstance().getSectionId())) {
                    continue;
                }
                if (candidate.getBlock().stream().anyMatch(preference::matches)) {
                    objective.addTerm(decisions[candidate.getIndex()], -preference.getWeight() * scale);
                    terms++;
                }
            }
        }
        log.debug("Added {} preference terms from {} preferences", terms, catalog.preferences().size());
        return terms;
    }

    private static Literal[] literalsOf(List<Candidate> candidates, BoolVar[] decisions) {
        Literal[] literals = new Literal[candidates.size()];
        for (int i = 0; i < candidates.size(); i++) {
            literals[i] = decisions[candidates.get(i).getIndex()];
        }
        return literals;
    }
}
