package com.projectkb.extract;

import org.apache.tika.Tika;

/**
 * Sniffs a media type from the leading bytes of a file, falling back to its extension.
 */
public class ContentTypeDetector {
    private final Tika tika;

    public ContentTypeDetector() {
        this(new Tika());
    }

    public ContentTypeDetector(Tika tika) {
        this.tika = tika;
    }

    public String detect(byte[] content, String filename) {
        return tika.detect(content, filename);
    }
}
