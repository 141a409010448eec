package com.coursecast.orchestrator.model;

import jakarta.persistence.*;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One PDF-to-video conversion submitted by a client.
 *
 * The row is the durable pipeline position: status + current_stage say where
 * the job is, and each stage's artifact reference says which stages are done.
 * Artifact references are write-once. Only the orchestrator and the explicit
 * operator actions (retry, cancel) change a Job, always through
 * {@link com.coursecast.orchestrator.repository.JobStore#update}.
 *
 * DB table: jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "jobs")
public class Job {

    /** Length of the error_message column; longer messages are cut to fit. */
    public static final int MAX_ERROR_MESSAGE = 4000;

    @Id
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_stage")
    private PipelineStage currentStage;

    @Column(name = "stage_progress", nullable = false)
    private int stageProgress = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "stage_started_at")
    private Instant stageStartedAt;

    // {"extract": 1.2, "generate": 45.3, ...}
    @Convert(converter = StageDurationsConverter.class)
    @Column(name = "stage_durations", nullable = false)
    private Map<String, Double> stageDurations = new LinkedHashMap<>();

    @Column(name = "original_filename", nullable = false, updatable = false)
    private String originalFilename;

    @Column(name = "pdf_path", nullable = false, updatable = false)
    private String pdfPath;

    // One artifact reference per stage. Null until that stage succeeds.
    @Column(name = "extracted_text_path")
    private String extractedTextPath;

    @Column(name = "timeline_path")
    private String timelinePath;

    @Column(name = "images_path")
    private String imagesPath;

    @Column(name = "audio_path")
    private String audioPath;

    @Column(name = "video_path")
    private String videoPath;

    @Column(name = "video_duration_seconds")
    private Double videoDurationSeconds;

    @Column(name = "slide_count")
    private Integer slideCount;

    @Column(name = "error_message", length = MAX_ERROR_MESSAGE)
    private String errorMessage;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_stage")
    private PipelineStage errorStage;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_kind")
    private FailureKind errorKind;

    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    // Automatic retries spent on current_stage; the ceiling applies to this.
    @Column(name = "stage_retry_count", nullable = false)
    private int stageRetryCount = 0;

    @Column(name = "cancel_requested", nullable = false)
    private boolean cancelRequested = false;

    @PreUpdate
    void onUpdate() {
        touch();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by JPA

    public Job(UUID id, String originalFilename, String pdfPath) {
        this.id               = id;
        this.originalFilename = originalFilename;
        this.pdfPath          = pdfPath;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    /** Enter (or re-enter) a stage from scratch. */
    public void markProcessing(PipelineStage stage) {
        this.status         = JobStatus.PROCESSING;
        this.currentStage   = stage;
        this.stageProgress  = 0;
        this.stageStartedAt = Instant.now();
        touch();
    }

    /**
     * Record a stage's artifact and elapsed time, then move current_stage on.
     * The caller completes the job separately after RENDER.
     */
    public void recordStageSuccess(PipelineStage stage, String artifactRef) {
        setArtifact(stage, artifactRef);
        if (stageStartedAt != null) {
            double seconds = Duration.between(stageStartedAt, Instant.now()).toMillis() / 1000.0;
            stageDurations.putIfAbsent(stage.value(), seconds);
        }
        this.stageRetryCount = 0;
        stage.next().ifPresent(this::markProcessing);
        touch();
    }

    public void markCompleted(double videoDurationSeconds, int slideCount) {
        this.status               = JobStatus.COMPLETED;
        this.currentStage         = null;
        this.stageProgress        = 100;
        this.videoDurationSeconds = videoDurationSeconds;
        this.slideCount           = slideCount;
        this.completedAt          = Instant.now();
        touch();
    }

    public void markFailed(PipelineStage stage, FailureKind kind, String message) {
        this.status       = JobStatus.FAILED;
        this.currentStage = null;
        this.errorStage   = stage;
        this.errorKind    = kind;
        this.errorMessage = truncate(message);
        // Terminal: a pending cancel does not carry over to an operator retry.
        this.cancelRequested = false;
        touch();
    }

    public void markCancelled() {
        this.status          = JobStatus.CANCELLED;
        this.currentStage    = null;
        this.cancelRequested = false;
        touch();
    }

    /** Note an automatic retry; the stage stays where it is. */
    public void recordAutomaticRetry(FailureKind kind, String message) {
        this.retryCount++;
        this.stageRetryCount++;
        this.errorKind    = kind;
        this.errorMessage = truncate(message);
        touch();
    }

    /**
     * Explicit operator retry from FAILED: clear the error fields and resume
     * at the stage that failed, or from the first missing artifact when the
     * failure happened outside any stage.
     */
    public void resetForRetry() {
        PipelineStage resumeAt = errorStage;
        this.errorMessage    = null;
        this.errorStage      = null;
        this.errorKind       = null;
        this.retryCount++;
        this.stageRetryCount = 0;
        this.completedAt     = null;
        this.cancelRequested = false;
        if (resumeAt != null) {
            markProcessing(resumeAt);
        } else {
            this.status        = JobStatus.PENDING;
            this.currentStage  = null;
            this.stageProgress = 0;
        }
        touch();
    }

    public void requestCancel() {
        this.cancelRequested = true;
        touch();
    }

    public void touch() {
        this.updatedAt = Instant.now();
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_MESSAGE) {
            return message;
        }
        String marker = "... [truncated]";
        return message.substring(0, MAX_ERROR_MESSAGE - marker.length()) + marker;
    }

    // ------------------------------------------------------------------
    // Artifact references by stage
    // ------------------------------------------------------------------

    public String artifactFor(PipelineStage stage) {
        return switch (stage) {
            case EXTRACT  -> extractedTextPath;
            case GENERATE -> timelinePath;
            case IMAGES   -> imagesPath;
            case TTS      -> audioPath;
            case RENDER   -> videoPath;
        };
    }

    private void setArtifact(PipelineStage stage, String ref) {
        if (artifactFor(stage) != null) {
            throw new IllegalStateException(
                    "Artifact for stage " + stage.value() + " already recorded on job " + id);
        }
        switch (stage) {
            case EXTRACT  -> this.extractedTextPath = ref;
            case GENERATE -> this.timelinePath      = ref;
            case IMAGES   -> this.imagesPath        = ref;
            case TTS      -> this.audioPath         = ref;
            case RENDER   -> this.videoPath         = ref;
        }
    }

    /** Detached copy, used where a snapshot must not share state with a live row. */
    public Job copy() {
        Job c = new Job(id, originalFilename, pdfPath);
        c.status               = status;
        c.currentStage         = currentStage;
        c.stageProgress        = stageProgress;
        c.createdAt            = createdAt;
        c.updatedAt            = updatedAt;
        c.completedAt          = completedAt;
        c.stageStartedAt       = stageStartedAt;
        c.stageDurations       = new LinkedHashMap<>(stageDurations);
        c.extractedTextPath    = extractedTextPath;
        c.timelinePath         = timelinePath;
        c.imagesPath           = imagesPath;
        c.audioPath            = audioPath;
        c.videoPath            = videoPath;
        c.videoDurationSeconds = videoDurationSeconds;
        c.slideCount           = slideCount;
        c.errorMessage         = errorMessage;
        c.errorStage           = errorStage;
        c.errorKind            = errorKind;
        c.retryCount           = retryCount;
        c.stageRetryCount      = stageRetryCount;
        c.cancelRequested      = cancelRequested;
        return c;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()                   { return id; }
    public JobStatus     getStatus()               { return status; }
    public PipelineStage getCurrentStage()         { return currentStage; }
    public int           getStageProgress()        { return stageProgress; }
    public Instant       getCreatedAt()            { return createdAt; }
    public Instant       getUpdatedAt()            { return updatedAt; }
    public Instant       getCompletedAt()          { return completedAt; }
    public Instant       getStageStartedAt()       { return stageStartedAt; }
    public String        getOriginalFilename()     { return originalFilename; }
    public String        getPdfPath()              { return pdfPath; }
    public String        getExtractedTextPath()    { return extractedTextPath; }
    public String        getTimelinePath()         { return timelinePath; }
    public String        getImagesPath()           { return imagesPath; }
    public String        getAudioPath()            { return audioPath; }
    public String        getVideoPath()            { return videoPath; }
    public Double        getVideoDurationSeconds() { return videoDurationSeconds; }
    public Integer       getSlideCount()           { return slideCount; }
    public String        getErrorMessage()         { return errorMessage; }
    public PipelineStage getErrorStage()           { return errorStage; }
    public FailureKind   getErrorKind()            { return errorKind; }
    public int           getRetryCount()           { return retryCount; }
    public int           getStageRetryCount()      { return stageRetryCount; }
    public boolean       isCancelRequested()       { return cancelRequested; }

    public Map<String, Double> getStageDurations() { return Map.copyOf(stageDurations); }

    public void setStageProgress(int stageProgress) {
        this.stageProgress = Math.max(0, Math.min(100, stageProgress));
    }
}
