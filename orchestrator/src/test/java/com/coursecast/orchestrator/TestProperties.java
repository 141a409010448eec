package com.coursecast.orchestrator;

import com.coursecast.orchestrator.config.CourseCastProperties;

import java.time.Duration;

/**
 * CourseCastProperties for unit tests: short backoffs and timeline limits
 * loose enough for three-segment, fifteen-second fixtures.
 */
public final class TestProperties {

    private TestProperties() {}

    public static CourseCastProperties create() {
        return create("./storage", 1024 * 1024);
    }

    public static CourseCastProperties create(String basePath, long maxUploadBytes) {
        return new CourseCastProperties(
                new CourseCastProperties.Storage(basePath),
                new CourseCastProperties.Upload(maxUploadBytes),
                new CourseCastProperties.Pipeline(2, 3,
                        Duration.ofMillis(100), Duration.ofSeconds(2), 2.0,
                        Duration.ofMinutes(15), Duration.ofSeconds(60)),
                new CourseCastProperties.Timeline(1, 20, 1, 120, 1, 900, 0.5),
                new CourseCastProperties.Gemini("", "http://localhost:1", "text-model", "image-model",
                        Duration.ofSeconds(5)),
                new CourseCastProperties.Tts("", "http://localhost:1/synthesize", "en-US", "voice", 1.0,
                        Duration.ofSeconds(5), 0.5),
                new CourseCastProperties.Renderer("http://localhost:1", Duration.ofSeconds(5), 30, 1920, 1080));
    }
}
