package com.coursecast.orchestrator.client;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Page-by-page text extraction with Apache PDFBox.
 *
 * Stops adding pages once MAX_WORDS is reached; rejects documents with
 * fewer than MIN_WORDS of extractable text (scanned images, blank files).
 */
@Component
public class PdfBoxTextExtractor implements PdfTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxTextExtractor.class);

    static final int MIN_WORDS = 100;
    static final int MAX_WORDS = 50_000;

    @Override
    public ExtractedDocument extract(byte[] pdf, String filename) {
        try (PDDocument document = Loader.loadPDF(pdf)) {
            PDFTextStripper stripper = new PDFTextStripper();
            int pageCount = document.getNumberOfPages();
            List<String> parts = new ArrayList<>();
            int totalWords = 0;

            for (int page = 1; page <= pageCount; page++) {
                if (totalWords >= MAX_WORDS) {
                    log.warn("Truncating '{}' at page {}, reached {} words", filename, page, MAX_WORDS);
                    break;
                }
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String pageText = stripper.getText(document);
                if (!pageText.isBlank()) {
                    parts.add("--- Page " + page + " ---\n" + pageText.strip());
                    totalWords += countWords(pageText);
                }
            }

            String text = String.join("\n\n", parts);
            int words = countWords(text);
            if (words < MIN_WORDS) {
                throw new CollaboratorException("PDF has too little content: " + words
                        + " words (minimum " + MIN_WORDS + " required)", false);
            }
            log.info("Extracted {} words from {} pages of '{}'", words, pageCount, filename);
            return new ExtractedDocument(filename, pageCount, words, text);
        } catch (InvalidPasswordException e) {
            throw new CollaboratorException("PDF is password protected", false, e);
        } catch (IOException e) {
            throw new CollaboratorException("Failed to parse PDF: " + e.getMessage(), false, e);
        }
    }

    private static int countWords(String text) {
        String trimmed = text.strip();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
