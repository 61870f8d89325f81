package com.projectkb.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.Test;

import com.projectkb.ingest.ErrorKind;

class ExtractionServiceTest {
    private static final byte[] PNG_HEADER = {
            (byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n', 0, 0, 0, 0x0D, 'I', 'H', 'D', 'R' };

    private final ExtractionService service = new ExtractionService();

    @Test
    void shouldExtractUtf8Text() throws Exception {
        byte[] content = "Grüße aus Köln\r\nzweite Zeile".getBytes(StandardCharsets.UTF_8);

        ExtractionResult result = service.extract("notes.txt", content, "text/plain");

        assertEquals("Grüße aus Köln\nzweite Zeile", result.text());
        assertEquals(DocumentFormat.TEXT, result.format());
        assertFalse(result.partial());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void shouldFallBackToLegacyCharsetWithWarning() throws Exception {
        byte[] content = "café crème".getBytes(Charset.forName("windows-1252"));

        ExtractionResult result = service.extract("legacy.txt", content, "text/plain");

        assertEquals("café crème", result.text());
        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).contains("windows-1252"));
    }

    @Test
    void shouldTreatMarkdownAsText() throws Exception {
        ExtractionResult result = service.extract("README.md", "# Title\nbody".getBytes(StandardCharsets.UTF_8),
                "text/markdown");

        assertEquals(DocumentFormat.TEXT, result.format());
        assertEquals("# Title\nbody", result.text());
    }

    @Test
    void shouldExtractPdfPagesInOrder() throws Exception {
        byte[] pdf = pdf("First page text", "Second page text");

        ExtractionResult result = service.extract("report.pdf", pdf, null);

        assertEquals(DocumentFormat.PDF, result.format());
        assertTrue(result.text().indexOf("First page text") < result.text().indexOf("Second page text"));
        assertTrue(result.text().contains("Second page text"));
        assertFalse(result.partial());
    }

    @Test
    void shouldExtractDocxParagraphs() throws Exception {
        byte[] docx;
        try (XWPFDocument document = new XWPFDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            document.createParagraph().createRun().setText("Opening paragraph");
            document.createParagraph().createRun().setText("Closing paragraph");
            document.write(out);
            docx = out.toByteArray();
        }

        ExtractionResult result = service.extract("memo.docx", docx, DocumentFormat.DOCX.mediaType());

        assertEquals(DocumentFormat.DOCX, result.format());
        assertTrue(result.text().indexOf("Opening paragraph") < result.text().indexOf("Closing paragraph"));
    }

    @Test
    void shouldRejectUnsupportedImage() {
        UnsupportedFormatException error = assertThrows(UnsupportedFormatException.class,
                () -> service.extract("diagram.png", PNG_HEADER, "image/png"));

        assertEquals(ErrorKind.UNSUPPORTED_FORMAT, error.kind());
        assertEquals("image/png", error.detectedType());
    }

    @Test
    void shouldDetectPdfWhenDeclaredTypeIsMissing() throws Exception {
        assertEquals(DocumentFormat.PDF, service.resolveFormat("upload.bin", pdf("x"), "application/octet-stream"));
    }

    @Test
    void shouldFailOnMalformedPdf() {
        byte[] broken = "%PDF-1.7\nthis is not really a pdf".getBytes(StandardCharsets.US_ASCII);

        ExtractionException error = assertThrows(ExtractionException.class,
                () -> service.extract("broken.pdf", broken, "application/pdf"));

        assertEquals(ErrorKind.EXTRACTION, error.kind());
    }

    @Test
    void shouldFailOnGarbageDocx() {
        byte[] garbage = "definitely not a zip container".getBytes(StandardCharsets.US_ASCII);

        assertThrows(ExtractionException.class,
                () -> service.extract("broken.docx", garbage, DocumentFormat.DOCX.mediaType()));
    }

    private static byte[] pdf(String... pages) throws IOException {
        try (PDDocument document = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            for (String text : pages) {
                PDPage page = new PDPage();
                document.addPage(page);
                try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
                    stream.beginText();
                    stream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                    stream.newLineAtOffset(72, 700);
                    stream.showText(text);
                    stream.endText();
                }
            }
            document.save(out);
            return out.toByteArray();
        }
    }
}
