package com.chunkforge.engine.model;

import jakarta.persistence.*;

import java.time.Duration;
import java.time.Instant;

/**
 * One generation request: an ordered set of chunks plus execution policy and
 * aggregate status.
 *
 * Counters are recomputed from the chunk records after every round, so
 * completedChunks + failedChunks never exceeds totalChunks.
 *
 * DB table: pipelines
 */
@Entity
@Table(name = "pipelines")
public class Pipeline {

    @Id
    private String id;

    @Column(name = "project_id", nullable = false)
    private String projectId;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "original_prompt", columnDefinition = "TEXT")
    private String originalPrompt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PipelineStatus status = PipelineStatus.PENDING;

    @Column(name = "total_chunks", nullable = false)
    private int totalChunks;

    @Column(name = "completed_chunks", nullable = false)
    private int completedChunks;

    @Column(name = "failed_chunks", nullable = false)
    private int failedChunks;

    @Column(name = "current_chunk_id")
    private String currentChunkId;

    // Execution policy, flattened into columns.
    @Column(nullable = false)
    private int parallelism = 1;

    @Column(name = "stop_on_error", nullable = false)
    private boolean stopOnError;

    @Column(name = "auto_retry", nullable = false)
    private boolean autoRetry = true;

    @Column(name = "max_context_tokens", nullable = false)
    private int maxContextTokens = PipelineConfig.DEFAULT_MAX_CONTEXT_TOKENS;

    // Aggregate stats.
    @Column(name = "total_tokens_used", nullable = false)
    private long totalTokensUsed;

    @Column(name = "total_files_generated", nullable = false)
    private long totalFilesGenerated;

    @Column(name = "total_lines_generated", nullable = false)
    private long totalLinesGenerated;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Pipeline() {}   // required by JPA

    public Pipeline(String id, String projectId, String name, String originalPrompt,
                    PipelineConfig config, int totalChunks, Instant now) {
        this.id             = id;
        this.projectId      = projectId;
        this.name           = name;
        this.originalPrompt = originalPrompt;
        this.description    = describe(originalPrompt);
        this.totalChunks    = totalChunks;
        this.createdAt      = now;
        this.updatedAt      = now;
        setConfig(config);
    }

    /** Detached copy, so callers never share mutable state with a store. */
    public Pipeline copy() {
        Pipeline p = new Pipeline();
        p.id                  = id;
        p.projectId           = projectId;
        p.name                = name;
        p.description         = description;
        p.originalPrompt      = originalPrompt;
        p.status              = status;
        p.totalChunks         = totalChunks;
        p.completedChunks     = completedChunks;
        p.failedChunks        = failedChunks;
        p.currentChunkId      = currentChunkId;
        p.parallelism         = parallelism;
        p.stopOnError         = stopOnError;
        p.autoRetry           = autoRetry;
        p.maxContextTokens    = maxContextTokens;
        p.totalTokensUsed     = totalTokensUsed;
        p.totalFilesGenerated = totalFilesGenerated;
        p.totalLinesGenerated = totalLinesGenerated;
        p.createdAt           = createdAt;
        p.updatedAt           = updatedAt;
        p.startedAt           = startedAt;
        p.completedAt         = completedAt;
        return p;
    }

    // ------------------------------------------------------------------
    // Mutations used by the stores
    // ------------------------------------------------------------------

    /**
     * Move to a new status, stamping startedAt on the first entry to RUNNING
     * and completedAt on entry to a terminal status.
     */
    public void transitionTo(PipelineStatus next, Instant now) {
        this.status = next;
        if (next == PipelineStatus.RUNNING && startedAt == null) {
            this.startedAt = now;
        }
        if (next.isTerminal()) {
            this.completedAt = now;
        }
        this.updatedAt = now;
    }

    public void recordProgress(int completed, int failed, String currentChunkId, Instant now) {
        this.completedChunks = completed;
        this.failedChunks    = failed;
        this.currentChunkId  = currentChunkId;
        this.updatedAt       = now;
    }

    public void addStats(long tokens, long files, long lines, Instant now) {
        this.totalTokensUsed     += tokens;
        this.totalFilesGenerated += files;
        this.totalLinesGenerated += lines;
        this.updatedAt            = now;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String         getId()              { return id; }
    public String         getProjectId()       { return projectId; }
    public String         getName()            { return name; }
    public String         getDescription()     { return description; }
    public String         getOriginalPrompt()  { return originalPrompt; }
    public PipelineStatus getStatus()          { return status; }
    public int            getTotalChunks()     { return totalChunks; }
    public int            getCompletedChunks() { return completedChunks; }
    public int            getFailedChunks()    { return failedChunks; }
    public String         getCurrentChunkId()  { return currentChunkId; }
    public Instant        getCreatedAt()       { return createdAt; }
    public Instant        getUpdatedAt()       { return updatedAt; }
    public Instant        getStartedAt()       { return startedAt; }
    public Instant        getCompletedAt()     { return completedAt; }

    public PipelineConfig getConfig() {
        return new PipelineConfig(parallelism, stopOnError, autoRetry, maxContextTokens);
    }

    public void setConfig(PipelineConfig config) {
        this.parallelism      = config.parallelism();
        this.stopOnError      = config.stopOnError();
        this.autoRetry        = config.autoRetry();
        this.maxContextTokens = config.maxContextTokens();
    }

    /**
     * Aggregate stats. durationMs runs from startedAt to completedAt, or to
     * {@code now} while the pipeline has not finished; null before start.
     */
    public PipelineStats getStats(Instant now) {
        Long durationMs = null;
        if (startedAt != null) {
            Instant end = completedAt != null ? completedAt : now;
            durationMs = Duration.between(startedAt, end).toMillis();
        }
        return new PipelineStats(totalTokensUsed, totalFilesGenerated, totalLinesGenerated, durationMs);
    }

    private static String describe(String prompt) {
        if (prompt == null) return null;
        String head = prompt.length() > 100 ? prompt.substring(0, 100) + "..." : prompt;
        return "Auto-generated pipeline for: " + head;
    }
}
