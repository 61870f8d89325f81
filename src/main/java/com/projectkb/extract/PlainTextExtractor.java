package com.projectkb.extract;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class PlainTextExtractor implements DocumentExtractor {
    private static final List<Charset> FALLBACK_CHARSETS = List.of(
            Charset.forName("windows-1252"),
            StandardCharsets.ISO_8859_1);

    @Override
    public boolean supports(DocumentFormat format) {
        return format == DocumentFormat.TEXT;
    }

    @Override
    public ExtractionResult extract(String filename, byte[] content, DocumentFormat format) throws ExtractionException {
        try {
            return ExtractionResult.complete(normalize(decode(content, StandardCharsets.UTF_8)), DocumentFormat.TEXT);
        } catch (CharacterCodingException utf8Failure) {
            for (Charset charset : FALLBACK_CHARSETS) {
                try {
                    String text = normalize(decode(content, charset));
                    return new ExtractionResult(text, DocumentFormat.TEXT, false,
                            List.of("decoded as " + charset.name() + " after UTF-8 failed"));
                } catch (CharacterCodingException e) {
                    utf8Failure.addSuppressed(e);
                }
            }
            throw new ExtractionException("Unable to decode " + filename + " as text", utf8Failure);
        }
    }

    private static String decode(byte[] content, Charset charset) throws CharacterCodingException {
        return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(content))
                .toString();
    }

    private static String normalize(String text) {
        String withoutBom = text.startsWith("\uFEFF") ? text.substring(1) : text;
        return withoutBom.replace("\r\n", "\n").replace('\r', '\n');
    }
}
