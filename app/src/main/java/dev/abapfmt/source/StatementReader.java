package dev.abapfmt.source;

import java.util.List;

/**
 * Turns source text into the ordered raw statement stream the formatter consumes.
 */
public interface StatementReader {

    /**
     * @throws UpstreamParseException when the text cannot be split into statements
     * @throws UpstreamObjectMissingException when the document holds nothing formattable
     */
    List<RawStatement> read(String fileName, String text);
}
