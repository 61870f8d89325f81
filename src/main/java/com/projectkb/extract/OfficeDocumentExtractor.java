package com.projectkb.extract;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.parser.microsoft.OfficeParser;
import org.apache.tika.parser.microsoft.ooxml.OOXMLParser;
import org.apache.tika.sax.BodyContentHandler;
import org.xml.sax.SAXException;

/**
 * Word documents, read paragraph by paragraph through Tika's Microsoft parsers.
 */
public class OfficeDocumentExtractor implements DocumentExtractor {

    @Override
    public boolean supports(DocumentFormat format) {
        return format == DocumentFormat.DOCX || format == DocumentFormat.DOC;
    }

    @Override
    public ExtractionResult extract(String filename, byte[] content, DocumentFormat format) throws ExtractionException {
        Parser parser = format == DocumentFormat.DOC ? new OfficeParser() : new OOXMLParser();
        BodyContentHandler handler = new BodyContentHandler(-1);
        try (InputStream stream = new ByteArrayInputStream(content)) {
            parser.parse(stream, handler, new Metadata(), new ParseContext());
        } catch (IOException | SAXException | TikaException | RuntimeException e) {
            throw new ExtractionException("Malformed " + format + " " + filename + ": " + e.getMessage(), e);
        }
        String text = handler.toString().replace("\r\n", "\n").replace('\r', '\n').strip();
        return ExtractionResult.complete(text, format);
    }
}
