package com.chunkforge.engine.repository;

import com.chunkforge.engine.model.Chunk;
import com.chunkforge.engine.model.ChunkKey;
import com.chunkforge.engine.model.ChunkStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * CRUD + scheduler queries for the chunks table.
 */
public interface ChunkRepository extends JpaRepository<Chunk, ChunkKey> {

    /** All chunks of a pipeline in ready-selection order. */
    List<Chunk> findByPipelineIdOrderByPriorityDescSequenceAsc(String pipelineId);

    List<Chunk> findByPipelineIdAndStatus(String pipelineId, ChunkStatus status);

    long countByPipelineId(String pipelineId);

    List<Chunk> findByProjectIdOrderByPriorityDescCreatedAtAscSequenceAsc(String projectId);
}
