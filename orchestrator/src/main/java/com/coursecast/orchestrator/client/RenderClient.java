package com.coursecast.orchestrator.client;

/** The out-of-process video renderer. */
public interface RenderClient {

    /** Blocks until the renderer has written the MP4 to {@code request.outputPath()}. */
    RenderedVideo render(RenderRequest request);

    boolean isHealthy();
}
