package com.coursecast.orchestrator.api;

public record ErrorResponse(String message, int status, long timestamp) {}
