package com.projectkb.extract;

import java.util.Locale;
import java.util.Optional;

public enum DocumentFormat {
    PDF("application/pdf"),
    DOCX("application/vnd.openxmlformats-officedocument.wordprocessingml.document"),
    DOC("application/msword"),
    TEXT("text/plain");

    private final String mediaType;

    DocumentFormat(String mediaType) {
        this.mediaType = mediaType;
    }

    public String mediaType() {
        return mediaType;
    }

    /**
     * Maps a media type (parameters such as {@code ;charset=} are ignored) to a supported format.
     * Every {@code text/*} type is read as plain text.
     */
    public static Optional<DocumentFormat> fromMediaType(String mediaType) {
        String normalized = normalize(mediaType);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        for (DocumentFormat format : values()) {
            if (format.mediaType.equals(normalized)) {
                return Optional.of(format);
            }
        }
        if (normalized.startsWith("text/")) {
            return Optional.of(TEXT);
        }
        return Optional.empty();
    }

    static String normalize(String mediaType) {
        if (mediaType == null) {
            return "";
        }
        return mediaType.toLowerCase(Locale.ROOT).split(";")[0].trim();
    }
}
