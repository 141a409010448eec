package com.coursecast.orchestrator.client;

import com.coursecast.orchestrator.config.CourseCastProperties;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Thin wrapper around the Gemini generateContent REST endpoint.
 *
 * Two uses: the text model writes the timeline JSON, the image model draws
 * slide backgrounds. Neither call retries internally; a transient failure
 * goes back to the orchestrator, which owns the retry decision.
 */
@Component
public class GeminiClient extends JsonHttpClient implements ContentGenerationClient, SlideImageClient {

    private static final Logger log = LoggerFactory.getLogger(GeminiClient.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GenerateResponse(List<Candidate> candidates) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Candidate(Content content, String finishReason) {}
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Content(List<Part> parts) {}
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Part(String text, InlineData inlineData) {}
        @JsonIgnoreProperties(ignoreUnknown = true)
        record InlineData(String mimeType, String data) {}

        List<Part> parts() {
            if (candidates == null || candidates.isEmpty()
                    || candidates.get(0).content() == null
                    || candidates.get(0).content().parts() == null) {
                return List.of();
            }
            return candidates.get(0).content().parts();
        }
    }

    private final CourseCastProperties.Gemini config;

    public GeminiClient(CourseCastProperties props, ObjectMapper objectMapper) {
        super(objectMapper);
        this.config = props.gemini();
    }

    @Override
    public String generateTimeline(ExtractedDocument document) {
        log.info("Requesting timeline for '{}' ({} words)", document.filename(), document.wordCount());
        Map<String, Object> body = Map.of(
                "contents", List.of(Map.of("parts", List.of(Map.of("text", timelinePrompt(document))))),
                "generationConfig", Map.of(
                        "responseMimeType", "application/json",
                        "temperature",      0.7));

        GenerateResponse resp = parse(
                postJson(endpoint(config.textModel()), body, config.timeout(), "Gemini timeline generation"),
                GenerateResponse.class, "Gemini timeline generation");

        return resp.parts().stream()
                .map(GenerateResponse.Part::text)
                .filter(Objects::nonNull)
                .findFirst()
                .orElseThrow(() -> new CollaboratorException("Gemini returned no timeline text", false));
    }

    @Override
    public byte[] generateSlideImage(String slideTitle, String visualPrompt) {
        Map<String, Object> body = Map.of(
                "contents", List.of(Map.of("parts", List.of(Map.of("text", imagePrompt(slideTitle, visualPrompt))))),
                "generationConfig", Map.of("responseModalities", List.of("TEXT", "IMAGE")));

        GenerateResponse resp = parse(
                postJson(endpoint(config.imageModel()), body, config.timeout(), "Gemini image generation"),
                GenerateResponse.class, "Gemini image generation");

        String data = resp.parts().stream()
                .map(GenerateResponse.Part::inlineData)
                .filter(Objects::nonNull)
                .map(GenerateResponse.InlineData::data)
                .findFirst()
                .orElseThrow(() -> new CollaboratorException(
                        "Gemini returned no image for slide '" + slideTitle + "'", false));
        return Base64.getDecoder().decode(data);
    }

    private String endpoint(String model) {
        return config.baseUrl() + "/models/" + model + ":generateContent?key="
                + URLEncoder.encode(config.apiKey(), StandardCharsets.UTF_8);
    }

    private static String imagePrompt(String slideTitle, String visualPrompt) {
        return """
                Create a clean, minimalist 16:9 slide background for a teacher training video.
                Slide topic: %s
                Visual description: %s
                Style: educational diagram, professional, calm colours, generous empty space
                for overlaid text, no words or letters in the image.
                """.formatted(slideTitle, visualPrompt);
    }

    private static String timelinePrompt(ExtractedDocument document) {
        return """
                You are an expert educational content designer creating teacher training videos.

                TASK: Analyse this curriculum chapter and create a video timeline that trains
                teachers on how to teach this topic effectively.

                SOURCE DOCUMENT: %s

                CONTENT:
                %s

                ---

                Requirements:
                - Total duration 300-600 seconds, 5-12 segments of 30-90 seconds each.
                - Each segment covers ONE teaching concept: a clear title, 2-4 bullets,
                  a full narration script (50-300 words) and a visual prompt for a clean,
                  pedagogy-focused slide background.
                - Explain HOW to teach, with age-appropriate strategies, examples and
                  common student misconceptions.

                OUTPUT FORMAT (strict JSON):
                {
                  "version": "1.0",
                  "title": "Teacher Training: [Topic Name]",
                  "topic_summary": "Brief summary of what teachers will learn",
                  "target_age_group": "e.g. 10-12 years",
                  "total_duration_seconds": <sum of segment durations>,
                  "segments": [
                    {
                      "segment_id": "seg_001",
                      "start_time_seconds": 0,
                      "duration_seconds": <duration>,
                      "slide": {
                        "title": "Segment title",
                        "bullets": ["Point 1", "Point 2"],
                        "visual_prompt": "Description for slide image generation"
                      },
                      "narration_text": "Full narration script..."
                    }
                  ]
                }

                CRITICAL:
                - segment ids are sequential: seg_001, seg_002, ...
                - start_time_seconds equals the sum of the previous durations; no gaps or overlaps
                - every field is required and non-empty
                """.formatted(document.filename(), document.text());
    }
}
