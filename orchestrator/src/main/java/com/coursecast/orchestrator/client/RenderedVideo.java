package com.coursecast.orchestrator.client;

public record RenderedVideo(String outputPath, double durationSeconds) {}
