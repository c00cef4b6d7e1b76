package com.chunkforge.engine.repository;

import com.chunkforge.engine.model.Pipeline;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * CRUD + query operations for the pipelines table.
 */
public interface PipelineRepository extends JpaRepository<Pipeline, String> {

    List<Pipeline> findByProjectIdOrderByCreatedAtAsc(String projectId);

    /**
     * Load a pipeline row with SELECT FOR UPDATE, so a status compare-and-set
     * from a lifecycle control cannot interleave with the run loop's update.
     * Must run inside a transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Pipeline p WHERE p.id = :id")
    Optional<Pipeline> findForUpdate(@Param("id") String id);
}
