package com.coursecast.orchestrator.client;

/** Produces a raw (unvalidated) timeline JSON document from extracted text. */
public interface ContentGenerationClient {

    String generateTimeline(ExtractedDocument document);
}
