package com.chunkforge.engine.model;

import com.chunkforge.engine.util.TokenEstimator;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One unit of generation work inside a Pipeline.
 *
 * A chunk is identified by {@code (pipelineId, id)}: the id is only unique
 * within its pipeline, so two pipelines may both have a chunk called "schema".
 * A chunk may only move to IN_PROGRESS once every id in {@link #getDependencies()}
 * refers to a COMPLETED chunk of the same pipeline. The store assigns
 * {@code sequence} at creation; it breaks priority ties when selecting ready chunks.
 *
 * DB table: chunks
 */
@Entity
@IdClass(ChunkKey.class)
@Table(name = "chunks", indexes = @Index(name = "idx_chunks_project", columnList = "project_id"))
public class Chunk {

    @Id
    @Column(name = "pipeline_id")
    private String pipelineId;

    @Id
    @Column(name = "chunk_id")
    private String id;

    @Column(name = "project_id", nullable = false)
    private String projectId;

    @Column(name = "parent_chunk_id")
    private String parentChunkId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ChunkType type;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(columnDefinition = "TEXT")
    private String prompt;

    // List columns hold JSON arrays (see StringListConverter).
    @Convert(converter = StringListConverter.class)
    @Column(name = "target_files", columnDefinition = "TEXT")
    private List<String> targetFiles = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> dependencies = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(name = "context_files", columnDefinition = "TEXT")
    private List<String> contextFiles = new ArrayList<>();

    @Column(nullable = false)
    private int priority;

    @Column(name = "estimated_tokens", nullable = false)
    private int estimatedTokens;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ChunkStatus status = ChunkStatus.PENDING;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "max_retries", nullable = false)
    private int maxRetries = ChunkDraft.DEFAULT_MAX_RETRIES;

    @Convert(converter = StringListConverter.class)
    @Column(name = "files_created", columnDefinition = "TEXT")
    private List<String> filesCreated = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(name = "files_modified", columnDefinition = "TEXT")
    private List<String> filesModified = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> errors = new ArrayList<>();

    // Raw generated text, kept for inspection and re-use by later chunks.
    @Column(columnDefinition = "TEXT")
    private String output;

    @Column(name = "actual_tokens")
    private Integer actualTokens;

    @Column(name = "seq_no", nullable = false)
    private long sequence;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Chunk() {}   // required by JPA

    public Chunk(ChunkDraft draft, String pipelineId, String projectId, long sequence, Instant now) {
        if (draft.id() == null) {
            throw new IllegalArgumentException("draft must carry an id before it is stored");
        }
        this.id              = draft.id();
        this.pipelineId      = pipelineId;
        this.projectId       = projectId;
        this.parentChunkId   = draft.parentChunkId();
        this.type            = draft.type();
        this.title           = draft.title();
        this.description     = draft.description();
        this.prompt          = draft.prompt();
        this.targetFiles     = new ArrayList<>(draft.targetFiles());
        this.dependencies    = new ArrayList<>(draft.dependencies());
        this.contextFiles    = new ArrayList<>(draft.contextFiles());
        this.priority        = draft.effectivePriority();
        this.estimatedTokens = draft.estimatedTokens() != null
                ? draft.estimatedTokens()
                : TokenEstimator.estimate(draft.prompt());
        this.maxRetries      = draft.effectiveMaxRetries();
        this.sequence        = sequence;
        this.createdAt       = now;
    }

    /** Detached copy, so executors and callers never share mutable state with a store. */
    public Chunk copy() {
        Chunk c = new Chunk();
        c.id              = id;
        c.pipelineId      = pipelineId;
        c.projectId       = projectId;
        c.parentChunkId   = parentChunkId;
        c.type            = type;
        c.title           = title;
        c.description     = description;
        c.prompt          = prompt;
        c.targetFiles     = new ArrayList<>(targetFiles);
        c.dependencies    = new ArrayList<>(dependencies);
        c.contextFiles    = new ArrayList<>(contextFiles);
        c.priority        = priority;
        c.estimatedTokens = estimatedTokens;
        c.status          = status;
        c.retryCount      = retryCount;
        c.maxRetries      = maxRetries;
        c.filesCreated    = new ArrayList<>(filesCreated);
        c.filesModified   = new ArrayList<>(filesModified);
        c.errors          = new ArrayList<>(errors);
        c.output          = output;
        c.actualTokens    = actualTokens;
        c.sequence        = sequence;
        c.createdAt       = createdAt;
        c.startedAt       = startedAt;
        c.completedAt     = completedAt;
        return c;
    }

    // ------------------------------------------------------------------
    // Mutations used by the stores
    // ------------------------------------------------------------------

    /**
     * Apply a status change. IN_PROGRESS stamps startedAt; COMPLETED and FAILED
     * stamp completedAt and record the result, when one is given.
     */
    public void applyStatus(ChunkStatus next, ChunkResult result, Instant now) {
        this.status = next;
        if (next == ChunkStatus.IN_PROGRESS) {
            this.startedAt = now;
        }
        if (next == ChunkStatus.COMPLETED || next == ChunkStatus.FAILED) {
            this.completedAt = now;
            if (result != null) {
                this.filesCreated  = new ArrayList<>(result.filesCreated());
                this.filesModified = new ArrayList<>(result.filesModified());
                this.errors        = new ArrayList<>(result.errors());
            }
        }
    }

    public int incrementRetry() {
        return ++retryCount;
    }

    public void setOutput(String output, Integer actualTokens) {
        this.output       = output;
        this.actualTokens = actualTokens;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String       getId()              { return id; }
    public String       getPipelineId()      { return pipelineId; }
    public String       getProjectId()       { return projectId; }
    public String       getParentChunkId()   { return parentChunkId; }
    public ChunkType    getType()            { return type; }
    public String       getTitle()           { return title; }
    public String       getDescription()     { return description; }
    public String       getPrompt()          { return prompt; }
    public List<String> getTargetFiles()     { return List.copyOf(targetFiles); }
    public List<String> getDependencies()    { return List.copyOf(dependencies); }
    public List<String> getContextFiles()    { return List.copyOf(contextFiles); }
    public int          getPriority()        { return priority; }
    public int          getEstimatedTokens() { return estimatedTokens; }
    public ChunkStatus  getStatus()          { return status; }
    public int          getRetryCount()      { return retryCount; }
    public int          getMaxRetries()      { return maxRetries; }
    public List<String> getFilesCreated()    { return List.copyOf(filesCreated); }
    public List<String> getFilesModified()   { return List.copyOf(filesModified); }
    public List<String> getErrors()          { return List.copyOf(errors); }
    public String       getOutput()          { return output; }
    public Integer      getActualTokens()    { return actualTokens; }
    public long         getSequence()        { return sequence; }
    public Instant      getCreatedAt()       { return createdAt; }
    public Instant      getStartedAt()       { return startedAt; }
    public Instant      getCompletedAt()     { return completedAt; }
}
