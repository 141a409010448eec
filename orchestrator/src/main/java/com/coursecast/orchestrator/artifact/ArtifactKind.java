package com.coursecast.orchestrator.artifact;

/**
 * Every kind of byte artifact the pipeline persists, with its file name
 * stem and extension. Paths are derived from (job, kind[, segment]) only,
 * so re-running a stage always writes to the same place.
 */
public enum ArtifactKind {
    SOURCE_PDF     ("source",    "pdf",  false),
    EXTRACTED_TEXT ("extracted", "json", false),
    TIMELINE       ("timeline",  "json", false),
    IMAGE_MANIFEST ("images",    "json", false),
    AUDIO_MANIFEST ("audio",     "json", false),
    VIDEO          ("video",     "mp4",  false),
    SLIDE_IMAGE    ("images",    "png",  true),
    NARRATION_AUDIO("audio",     "wav",  true);

    private final String stem;
    private final String extension;
    private final boolean perSegment;

    ArtifactKind(String stem, String extension, boolean perSegment) {
        this.stem       = stem;
        this.extension  = extension;
        this.perSegment = perSegment;
    }

    public String stem()         { return stem; }
    public String extension()    { return extension; }
    public boolean isPerSegment() { return perSegment; }
}
