package com.coursecast.orchestrator.client;

/** Text pulled out of the uploaded PDF, page markers included. */
public record ExtractedDocument(String filename, int pageCount, int wordCount, String text) {}
