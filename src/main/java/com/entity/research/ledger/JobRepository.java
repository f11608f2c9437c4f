package com.entity.research.ledger;

import com.entity.research.core.model.CandidateRecord;

import java.util.List;
import java.util.Optional;

/**
 * Storage for job snapshots and their candidate records.
 * Implementations may back this with any store; records are append-only.
 */
public interface JobRepository {

    Job save(Job job);

    Optional<Job> findById(String jobId);

    List<Job> findAll();

    /**
     * Appends records collected by one strategy of one job.
     */
    void appendCandidates(String jobId, String strategyId, List<CandidateRecord> records);

    /**
     * Records of one strategy of one job, in output order.
     */
    List<CandidateRecord> findCandidates(String jobId, String strategyId);

    /**
     * All records of a job, grouped by strategy in the order strategies first reported.
     */
    List<CandidateRecord> findCandidates(String jobId);
}
