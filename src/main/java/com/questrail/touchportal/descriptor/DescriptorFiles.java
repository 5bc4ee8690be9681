package com.questrail.touchportal.descriptor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reading and writing descriptor and declaration documents.
 */
public final class DescriptorFiles
{
    private static final ObjectMapper MAPPER =
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private DescriptorFiles() {}

    /**
     * Reads a file as text. Parsing is left to the caller so that malformed
     * JSON can be reported as a violation instead of an I/O failure.
     */
    public static String readText(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    /**
     * @throws JsonProcessingException if the file is not a JSON document
     */
    public static JsonNode read(Path file) throws IOException {
        return MAPPER.readTree(readText(file));
    }

    /**
     * Writes {@code document} followed by a newline.
     *
     * @param indent spaces per nesting level; negative for compact output
     */
    public static void write(Path file, JsonNode document, int indent) throws IOException {
        Objects.requireNonNull(file, "file");
        Files.writeString(file, toJson(document, indent) + System.lineSeparator(), StandardCharsets.UTF_8);
    }

    public static String toJson(JsonNode document, int indent) {
        Objects.requireNonNull(document, "document");
        try {
            if (indent < 0) {
                return MAPPER.writeValueAsString(document);
            }
            DefaultIndenter indenter = new DefaultIndenter(" ".repeat(indent), DefaultIndenter.SYS_LF);
            DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                    .withObjectIndenter(indenter);
            printer.indentArraysWith(indenter);
            return MAPPER.writer(printer).writeValueAsString(document);
        } catch (JsonProcessingException e) {
            // tree nodes always serialize
            throw new UncheckedIOException(e);
        }
    }
}
