package com.coursecast.orchestrator.client;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/** Reports the render service under /actuator/health as "renderer". */
@Component("renderer")
public class RendererHealthIndicator implements HealthIndicator {

    private final RenderClient renderClient;

    public RendererHealthIndicator(RenderClient renderClient) {
        this.renderClient = renderClient;
    }

    @Override
    public Health health() {
        return renderClient.isHealthy()
                ? Health.up().build()
                : Health.down().withDetail("reason", "render service unreachable").build();
    }
}
