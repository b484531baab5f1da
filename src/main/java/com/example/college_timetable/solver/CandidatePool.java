package com.example.college_timetable.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Session instances of one run together with the candidate placements of each,
 * in the order the generator produced them.
 */
public class CandidatePool {
    private final Map<SessionInstance, List<Candidate>> candidatesByInstance = new LinkedHashMap<>();
    private final List<Candidate> allCandidates = new ArrayList<>();

    void add(SessionInstance instance, List<Candidate> candidates) {
        candidatesByInstance.put(instance, Collections.unmodifiableList(new ArrayList<>(candidates)));
        allCandidates.addAll(candidates);
    }

    public List<SessionInstance> getInstances() {
        return List.copyOf(candidatesByInstance.keySet());
    }

    public List<Candidate> candidatesFor(SessionInstance instance) {
        List<Candidate> candidates = candidatesByInstance.get(instance);
        if (candidates == null) {
            throw new IllegalArgumentException("Unknown session instance: " + instance.getId());
        }
        return candidates;
    }

    public List<Candidate> getAllCandidates() {
        return Collections.unmodifiableList(allCandidates);
    }

    public int size() {
        return allCandidates.size();
    }
}
