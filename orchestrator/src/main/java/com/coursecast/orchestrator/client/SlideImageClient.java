package com.coursecast.orchestrator.client;

/** Generates one slide background image (PNG bytes) from a visual prompt. */
public interface SlideImageClient {

    byte[] generateSlideImage(String slideTitle, String visualPrompt);
}
