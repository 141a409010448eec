package com.coursecast.orchestrator.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * All coursecast.* settings from application.yml.
 *
 * API keys are bound from the environment (GEMINI_API_KEY, GOOGLE_TTS_API_KEY)
 * through placeholders in application.yml and may be blank in tests.
 */
@Validated
@ConfigurationProperties(prefix = "coursecast")
public record CourseCastProperties(
        @Valid @NotNull @DefaultValue Storage  storage,
        @Valid @NotNull @DefaultValue Upload   upload,
        @Valid @NotNull @DefaultValue Pipeline pipeline,
        @Valid @NotNull @DefaultValue Timeline timeline,
        @Valid @NotNull @DefaultValue Gemini   gemini,
        @Valid @NotNull @DefaultValue Tts      tts,
        @Valid @NotNull @DefaultValue Renderer renderer
) {

    public record Storage(@NotBlank @DefaultValue("./storage") String basePath) {}

    public record Upload(@Min(1) @DefaultValue("52428800") long maxBytes) {}

    /**
     * @param maxStageRetries automatic retries allowed per stage before the job fails
     * @param stallAfter      an in-flight job untouched for this long is re-enqueued
     */
    public record Pipeline(
            @Min(1) @DefaultValue("4")      int      workerCount,
            @Min(0) @DefaultValue("3")      int      maxStageRetries,
            @NotNull @DefaultValue("2s")    Duration initialBackoff,
            @NotNull @DefaultValue("60s")   Duration maxBackoff,
            @DecimalMin("1.0") @DefaultValue("2.0") double backoffMultiplier,
            @NotNull @DefaultValue("15m")   Duration stallAfter,
            @NotNull @DefaultValue("PT60S") Duration recoveryInterval
    ) {}

    /** Structural and temporal limits a generated timeline must satisfy. */
    public record Timeline(
            @Min(1) @DefaultValue("3")      int    minSegments,
            @Min(1) @DefaultValue("20")     int    maxSegments,
            @DefaultValue("5")              double minSegmentSeconds,
            @DefaultValue("120")            double maxSegmentSeconds,
            @DefaultValue("180")            double minTotalSeconds,
            @DefaultValue("900")            double maxTotalSeconds,
            @DefaultValue("0.5")            double toleranceSeconds
    ) {}

    public record Gemini(
            @DefaultValue("")                                                String   apiKey,
            @NotBlank @DefaultValue("https://generativelanguage.googleapis.com/v1beta") String baseUrl,
            @NotBlank @DefaultValue("gemini-2.5-flash")                      String   textModel,
            @NotBlank @DefaultValue("gemini-2.5-flash-image")                String   imageModel,
            @NotNull  @DefaultValue("120s")                                  Duration timeout
    ) {}

    /** @param overrunToleranceSeconds how far narration may exceed its segment before tts fails */
    public record Tts(
            @DefaultValue("")                                                  String   apiKey,
            @NotBlank @DefaultValue("https://texttospeech.googleapis.com/v1/text:synthesize") String url,
            @NotBlank @DefaultValue("en-US")                                   String   languageCode,
            @NotBlank @DefaultValue("en-US-Journey-F")                         String   voiceName,
            @DefaultValue("0.95")                                              double   speakingRate,
            @NotNull  @DefaultValue("60s")                                     Duration timeout,
            @DefaultValue("0.5")                                               double   overrunToleranceSeconds
    ) {}

    public record Renderer(
            @NotBlank @DefaultValue("http://localhost:3000") String   baseUrl,
            @NotNull  @DefaultValue("10m")                   Duration timeout,
            @Min(1)   @DefaultValue("30")                    int      fps,
            @Min(1)   @DefaultValue("1920")                  int      width,
            @Min(1)   @DefaultValue("1080")                  int      height
    ) {}
}
