package com.projectkb.extract;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns raw file bytes into plain text. The declared content type is trusted when it names a
 * supported format; otherwise the type is sniffed from the bytes and the filename.
 */
public class ExtractionService {
    private static final Logger log = LoggerFactory.getLogger(ExtractionService.class);

    private final ContentTypeDetector detector;
    private final List<DocumentExtractor> extractors;

    public ExtractionService() {
        this(new ContentTypeDetector());
    }

    public ExtractionService(ContentTypeDetector detector) {
        this.detector = detector;
        this.extractors = List.of(new PdfDocumentExtractor(), new OfficeDocumentExtractor(), new PlainTextExtractor());
    }

    public ExtractionResult extract(String filename, byte[] content, String declaredType)
            throws UnsupportedFormatException, ExtractionException {
        DocumentFormat format = resolveFormat(filename, content, declaredType);
        for (DocumentExtractor extractor : extractors) {
            if (extractor.supports(format)) {
                ExtractionResult result = extractor.extract(filename, content, format);
                if (result.partial()) {
                    log.warn("extract.partial file={} warnings={}", filename, result.warnings());
                }
                return result;
            }
        }
        throw new UnsupportedFormatException(filename, format.mediaType());
    }

    public DocumentFormat resolveFormat(String filename, byte[] content, String declaredType)
            throws UnsupportedFormatException {
        Optional<DocumentFormat> declared = DocumentFormat.fromMediaType(declaredType);
        if (declared.isPresent()) {
            return declared.get();
        }
        String detected = detector.detect(content, filename);
        log.debug("extract.detect file={} declared={} detected={}", filename, declaredType, detected);
        return DocumentFormat.fromMediaType(detected)
                .orElseThrow(() -> new UnsupportedFormatException(filename, detected));
    }
}
