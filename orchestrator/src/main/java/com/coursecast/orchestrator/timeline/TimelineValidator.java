package com.coursecast.orchestrator.timeline;

import com.coursecast.orchestrator.config.CourseCastProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural and temporal checks for a generated timeline.
 *
 * Runs after every content generation call and before anything is persisted.
 * It never repairs a timeline: any violation fails the job, and the fix is a
 * fresh generation.
 *
 * Rules (limits from coursecast.timeline.*):
 * <ul>
 *   <li>segment count within [min-segments, max-segments], and never zero</li>
 *   <li>segment ids are seg_001, seg_002, ... in order</li>
 *   <li>durations non-negative and within [min-segment-seconds, max-segment-seconds]</li>
 *   <li>start times strictly increasing, first at 0, each segment starting where the previous ends</li>
 *   <li>declared total equals the sum of durations; the sum within [min-total-seconds, max-total-seconds]</li>
 *   <li>slide title, bullets (1-5), visual prompt and narration all non-empty</li>
 * </ul>
 */
@Component
public class TimelineValidator {

    private static final Logger log = LoggerFactory.getLogger(TimelineValidator.class);

    private static final int MAX_BULLETS = 5;

    private final CourseCastProperties.Timeline limits;
    private final ObjectMapper json;

    @Autowired
    public TimelineValidator(CourseCastProperties props, ObjectMapper objectMapper) {
        this(props.timeline(), objectMapper);
    }

    public TimelineValidator(CourseCastProperties.Timeline limits, ObjectMapper objectMapper) {
        this.limits = limits;
        this.json   = objectMapper;
    }

    /**
     * Parse and validate raw timeline JSON.
     *
     * @throws TimelineValidationException listing every violation found
     */
    public Timeline parse(String rawJson) throws TimelineValidationException {
        Timeline timeline;
        try {
            timeline = json.readValue(rawJson, Timeline.class);
        } catch (JsonProcessingException e) {
            throw new TimelineValidationException(List.of("Timeline is not valid JSON: " + e.getOriginalMessage()));
        }
        if (timeline == null) {
            throw new TimelineValidationException(List.of("Timeline is empty"));
        }
        validate(timeline);
        return timeline;
    }

    public void validate(Timeline timeline) throws TimelineValidationException {
        List<String> errors = new ArrayList<>();

        if (isBlank(timeline.title())) {
            errors.add("Missing required field: title");
        }
        if (timeline.totalDurationSeconds() == null) {
            errors.add("Missing required field: total_duration_seconds");
        }
        List<TimelineSegment> segments = timeline.segments();
        if (segments == null || segments.isEmpty()) {
            errors.add("Timeline has no segments");
            throw fail(errors);
        }

        if (segments.size() < limits.minSegments()) {
            errors.add("Too few segments: " + segments.size() + " (minimum " + limits.minSegments() + ")");
        }
        if (segments.size() > limits.maxSegments()) {
            errors.add("Too many segments: " + segments.size() + " (maximum " + limits.maxSegments() + ")");
        }

        double sum = 0;
        Double previousStart = null;
        Double previousEnd   = null;
        for (int i = 0; i < segments.size(); i++) {
            TimelineSegment seg = segments.get(i);
            String expectedId = "seg_%03d".formatted(i + 1);
            String prefix = "Segment " + (i + 1) + " (" + seg.segmentId() + ")";

            if (!expectedId.equals(seg.segmentId())) {
                errors.add(prefix + ": id should be " + expectedId);
            }

            Double start = seg.startTimeSeconds();
            Double duration = seg.durationSeconds();
            if (start == null || duration == null) {
                errors.add(prefix + ": start_time_seconds and duration_seconds are required");
                previousStart = null;
                previousEnd   = null;
                continue;
            }

            if (duration < 0) {
                errors.add(prefix + ": negative duration (" + duration + "s)");
            } else if (duration < limits.minSegmentSeconds()) {
                errors.add(prefix + ": duration too short (" + duration + "s, min " + limits.minSegmentSeconds() + "s)");
            } else if (duration > limits.maxSegmentSeconds()) {
                errors.add(prefix + ": duration too long (" + duration + "s, max " + limits.maxSegmentSeconds() + "s)");
            }

            if (i == 0 && Math.abs(start) > limits.toleranceSeconds()) {
                errors.add(prefix + ": first segment must start at 0, got " + start);
            }
            if (previousStart != null && start <= previousStart) {
                errors.add(prefix + ": start_time_seconds " + start
                        + " is not after the previous segment's " + previousStart);
            } else if (previousEnd != null && Math.abs(start - previousEnd) > limits.toleranceSeconds()) {
                errors.add(prefix + ": gap or overlap, previous segment ends at " + previousEnd
                        + " but this one starts at " + start);
            }

            checkContent(seg, prefix, errors);

            sum += duration;
            previousStart = start;
            previousEnd   = start + duration;
        }

        Double declared = timeline.totalDurationSeconds();
        if (declared != null && Math.abs(declared - sum) > limits.toleranceSeconds()) {
            errors.add("total_duration_seconds (" + declared + ") doesn't match sum of segments (" + sum + ")");
        }
        if (sum < limits.minTotalSeconds()) {
            errors.add("Video too short: " + sum + "s (minimum " + limits.minTotalSeconds() + "s)");
        }
        if (sum > limits.maxTotalSeconds()) {
            errors.add("Video too long: " + sum + "s (maximum " + limits.maxTotalSeconds() + "s)");
        }

        if (!errors.isEmpty()) {
            throw fail(errors);
        }
        log.debug("Timeline '{}' passed validation: {} segments, {}s",
                timeline.title(), segments.size(), sum);
    }

    private static void checkContent(TimelineSegment seg, String prefix, List<String> errors) {
        Slide slide = seg.slide();
        if (slide == null) {
            errors.add(prefix + ": slide is missing");
        } else {
            if (isBlank(slide.title())) {
                errors.add(prefix + ": slide.title is empty");
            }
            List<String> bullets = slide.bullets();
            if (bullets == null || bullets.isEmpty()) {
                errors.add(prefix + ": slide.bullets is empty");
            } else if (bullets.size() > MAX_BULLETS) {
                errors.add(prefix + ": too many bullets (" + bullets.size() + ", max " + MAX_BULLETS + ")");
            } else if (bullets.stream().anyMatch(TimelineValidator::isBlank)) {
                errors.add(prefix + ": slide.bullets contains an empty bullet");
            }
            if (isBlank(slide.visualPrompt())) {
                errors.add(prefix + ": slide.visual_prompt is empty");
            }
        }
        if (isBlank(seg.narrationText())) {
            errors.add(prefix + ": narration_text is empty");
        }
    }

    private static TimelineValidationException fail(List<String> errors) {
        errors.forEach(e -> log.warn("Timeline rejected: {}", e));
        return new TimelineValidationException(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
