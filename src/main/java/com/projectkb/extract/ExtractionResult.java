package com.projectkb.extract;

import java.util.List;

/**
 * Plain text of one file. {@code partial} is set when some of the source could not be read;
 * {@code warnings} say which part.
 */
public record ExtractionResult(String text, DocumentFormat format, boolean partial, List<String> warnings) {
    public ExtractionResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ExtractionResult complete(String text, DocumentFormat format) {
        return new ExtractionResult(text, format, false, List.of());
    }
}
