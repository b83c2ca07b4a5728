package org.hdldoc.parser.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface of a hardware description language parser.
 */
public interface IHdlParser {

    /**
     * Parses a source text.
     *
     * @param text The complete source text of one file.
     * @param sourceName A name for the source, used in error positions.
     * @return The modules found in the text, in source order.
     * @throws HdlParseException if the text cannot be parsed.
     */
    List<VerilogModule> parse(String text, String sourceName) throws HdlParseException;

    /**
     * Parses a source text that has no file name.
     * @param text The complete source text.
     * @return The modules found in the text, in source order.
     * @throws HdlParseException if the text cannot be parsed.
     */
    default List<VerilogModule> parse(String text) throws HdlParseException {
        return parse(text, "<memory>");
    }

    /**
     * Reads a UTF-8 encoded file and parses it.
     * @param file The file to parse.
     * @return The modules found in the file, in source order.
     * @throws HdlParseException if the file cannot be read or parsed.
     */
    default List<VerilogModule> parseFile(Path file) throws HdlParseException {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new HdlParseException(ParseErrorCode.IO_ERROR_READING_FILE,
                    "Could not read " + file + ": " + e.getMessage(), e);
        }
        return parse(text, file.toString().replace('\\', '/'));
    }
}
