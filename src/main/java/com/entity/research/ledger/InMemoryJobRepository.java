package com.entity.research.ledger;

import com.entity.research.core.model.CandidateRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link JobRepository}. Thread-safe.
 */
public class InMemoryJobRepository implements JobRepository {

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final Map<String, Map<String, List<CandidateRecord>>> candidates = new ConcurrentHashMap<>();

    @Override
    public Job save(Job job) {
        jobs.put(job.getId(), job);
        return job;
    }

    @Override
    public Optional<Job> findById(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public List<Job> findAll() {
        return Collections.unmodifiableList(new ArrayList<>(jobs.values()));
    }

    @Override
    public void appendCandidates(String jobId, String strategyId, List<CandidateRecord> records) {
        Map<String, List<CandidateRecord>> byStrategy =
                candidates.computeIfAbsent(jobId, k -> Collections.synchronizedMap(new LinkedHashMap<>()));
        byStrategy.computeIfAbsent(strategyId, k -> new CopyOnWriteArrayList<>()).addAll(records);
    }

    @Override
    public List<CandidateRecord> findCandidates(String jobId, String strategyId) {
        Map<String, List<CandidateRecord>> byStrategy = candidates.get(jobId);
        if (byStrategy == null) {
            return List.of();
        }
        List<CandidateRecord> records = byStrategy.get(strategyId);
        return records == null ? List.of() : List.copyOf(records);
    }

    @Override
    public List<CandidateRecord> findCandidates(String jobId) {
        Map<String, List<CandidateRecord>> byStrategy = candidates.get(jobId);
        if (byStrategy == null) {
            return List.of();
        }
        List<CandidateRecord> all = new ArrayList<>();
        synchronized (byStrategy) {
            byStrategy.values().forEach(all::addAll);
        }
        return all;
    }
}
