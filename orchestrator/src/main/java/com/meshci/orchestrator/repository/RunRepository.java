package com.meshci.orchestrator.repository;

import com.meshci.orchestrator.model.Run;
import com.meshci.orchestrator.model.RunState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * CRUD + query operations for the runs table.
 */
public interface RunRepository extends JpaRepository<Run, UUID> {

    /** Used on startup to find runs interrupted by an orchestrator restart. */
    List<Run> findByStateIn(Collection<RunState> states);
}
