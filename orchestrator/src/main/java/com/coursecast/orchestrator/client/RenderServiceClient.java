package com.coursecast.orchestrator.client;

import com.coursecast.orchestrator.config.CourseCastProperties;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP client for the render service (a Node process composing the MP4).
 *
 * The renderer reads images and audio straight from the shared storage
 * volume, so only paths cross the wire.
 */
@Component
public class RenderServiceClient extends JsonHttpClient implements RenderClient {

    private static final Logger log = LoggerFactory.getLogger(RenderServiceClient.class);

    private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(5);

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record RenderResponse(boolean success, String outputPath, Double durationSeconds, String error) {}

    private final CourseCastProperties.Renderer config;

    public RenderServiceClient(CourseCastProperties props, ObjectMapper objectMapper) {
        super(objectMapper);
        this.config = props.renderer();
    }

    @Override
    public RenderedVideo render(RenderRequest request) {
        log.info("Rendering {} segments ({}s) to {}",
                request.segments().size(), request.totalDurationSeconds(), request.outputPath());

        RenderResponse resp = parse(
                postJson(config.baseUrl() + "/render", request, config.timeout(), "Render"),
                RenderResponse.class, "Render");

        if (!resp.success()) {
            throw new CollaboratorException("Renderer reported failure: " + resp.error(), false);
        }
        if (resp.durationSeconds() == null) {
            throw new CollaboratorException("Renderer response has no duration_seconds", false);
        }
        String path = resp.outputPath() != null ? resp.outputPath() : request.outputPath();
        return new RenderedVideo(path, resp.durationSeconds());
    }

    @Override
    public boolean isHealthy() {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(config.baseUrl() + "/health"))
                    .timeout(HEALTH_TIMEOUT)
                    .GET()
                    .build();
            return http.send(req, HttpResponse.BodyHandlers.discarding()).statusCode() == 200;
        } catch (IOException e) {
            log.debug("Renderer health check failed: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
