package com.coursecast.orchestrator.stage.impl;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** One entry of the audio manifest: where the clip is and how long it plays. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AudioClip(String ref, double durationSeconds) {}
