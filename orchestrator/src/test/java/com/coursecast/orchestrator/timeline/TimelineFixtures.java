package com.coursecast.orchestrator.timeline;

import java.util.ArrayList;
import java.util.List;

/** Contiguous, well-formed timelines built from a list of segment durations. */
public final class TimelineFixtures {

    private TimelineFixtures() {}

    public static Timeline timeline(double... durations) {
        List<TimelineSegment> segments = new ArrayList<>();
        double start = 0;
        double total = 0;
        for (int i = 0; i < durations.length; i++) {
            segments.add(segment(i + 1, start, durations[i]));
            start += durations[i];
            total += durations[i];
        }
        return new Timeline("1.0", "Teacher Training: Fractions", "How to teach fractions",
                "8-10 years", total, segments);
    }

    public static TimelineSegment segment(int n, double start, double duration) {
        return new TimelineSegment(
                "seg_%03d".formatted(n),
                start,
                duration,
                new Slide("Slide " + n, List.of("Point A", "Point B"), "A pie cut into " + n + " pieces"),
                "Narration for segment " + n + ".");
    }

    /** Snake-case JSON for {@link #timeline}, as the content generator returns it. */
    public static String json(double... durations) {
        StringBuilder sb = new StringBuilder();
        double total = 0;
        for (double d : durations) total += d;
        sb.append("{\"version\":\"1.0\",\"title\":\"Teacher Training: Fractions\",")
          .append("\"topic_summary\":\"How to teach fractions\",\"target_age_group\":\"8-10 years\",")
          .append("\"total_duration_seconds\":").append(total).append(",\"segments\":[");
        double start = 0;
        for (int i = 0; i < durations.length; i++) {
            if (i > 0) sb.append(',');
            sb.append("{\"segment_id\":\"seg_%03d\",".formatted(i + 1))
              .append("\"start_time_seconds\":").append(start).append(',')
              .append("\"duration_seconds\":").append(durations[i]).append(',')
              .append("\"slide\":{\"title\":\"Slide ").append(i + 1)
              .append("\",\"bullets\":[\"Point A\",\"Point B\"],\"visual_prompt\":\"A pie chart\"},")
              .append("\"narration_text\":\"Narration for segment ").append(i + 1).append(".\"}");
            start += durations[i];
        }
        return sb.append("]}").toString();
    }
}
