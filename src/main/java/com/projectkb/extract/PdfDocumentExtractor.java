package com.projectkb.extract;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts PDF text page by page so that one unreadable page only flags the result as partial.
 */
public class PdfDocumentExtractor implements DocumentExtractor {
    private static final Logger log = LoggerFactory.getLogger(PdfDocumentExtractor.class);

    @Override
    public boolean supports(DocumentFormat format) {
        return format == DocumentFormat.PDF;
    }

    @Override
    public ExtractionResult extract(String filename, byte[] content, DocumentFormat format) throws ExtractionException {
        try (PDDocument document = Loader.loadPDF(content)) {
            int pageCount = document.getNumberOfPages();
            List<String> pages = new ArrayList<>(pageCount);
            List<String> warnings = new ArrayList<>();
            for (int page = 1; page <= pageCount; page++) {
                try {
                    PDFTextStripper stripper = new PDFTextStripper();
                    stripper.setStartPage(page);
                    stripper.setEndPage(page);
                    pages.add(normalize(stripper.getText(document)));
                } catch (IOException | RuntimeException e) {
                    log.warn("extract.pdf.page.failed file={} page={} reason={}", filename, page, e.getMessage());
                    warnings.add("page " + page + " could not be read: " + e.getMessage());
                }
            }
            if (pageCount > 0 && pages.isEmpty()) {
                throw new ExtractionException("No readable page in " + filename);
            }
            String text = String.join("\n\n", pages.stream().filter(page -> !page.isEmpty()).toList());
            return new ExtractionResult(text, DocumentFormat.PDF, !warnings.isEmpty(), warnings);
        } catch (IOException e) {
            throw new ExtractionException("Malformed PDF " + filename + ": " + e.getMessage(), e);
        }
    }

    private static String normalize(String text) {
        return text.replace("\r\n", "\n").replace('\r', '\n').strip();
    }
}
