package com.meshci.orchestrator.repository;

import com.meshci.orchestrator.model.JobRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + lookups for the run_jobs table.
 */
public interface JobRecordRepository extends JpaRepository<JobRecord, UUID> {

    /** All jobs of a run, in declaration order. */
    List<JobRecord> findByRunIdOrderByCreatedAtAsc(UUID runId);

    Optional<JobRecord> findByRunIdAndName(UUID runId, String name);
}
