package com.coursecast.orchestrator.client;

/** Turns PDF bytes into structured text. */
public interface PdfTextExtractor {

    /**
     * @throws CollaboratorException permanent when the PDF is malformed,
     *         encrypted or has too little text
     */
    ExtractedDocument extract(byte[] pdf, String filename);
}
