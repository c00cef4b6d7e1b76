package com.chunkforge.engine.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Primary key of a {@link Chunk}: the owning pipeline plus the chunk id,
 * which is unique only within that pipeline.
 */
public class ChunkKey implements Serializable {

    private String pipelineId;
    private String id;

    protected ChunkKey() {}   // required by JPA

    public ChunkKey(String pipelineId, String id) {
        this.pipelineId = pipelineId;
        this.id         = id;
    }

    public String getPipelineId() { return pipelineId; }
    public String getId()         { return id; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChunkKey other)) return false;
        return Objects.equals(pipelineId, other.pipelineId) && Objects.equals(id, other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pipelineId, id);
    }

    @Override
    public String toString() {
        return pipelineId + "/" + id;
    }
}
