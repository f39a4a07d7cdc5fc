package com.docassets.util;

import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Shared Jackson configuration for the manifest file: two-space indentation,
 * {@code "key": value} separators and LF line endings on every platform.
 */
public final class ManifestJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final ObjectWriter WRITER;

    // Always millisecond precision, e.g. 2024-05-01T10:15:30.000Z
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
            .withZone(ZoneOffset.UTC);

    static {
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withSeparators(Separators.createDefaultInstance()
                        .withObjectFieldValueSpacing(Separators.Spacing.AFTER));
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);
        WRITER = MAPPER.writer(printer);
    }

    private ManifestJson() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectWriter prettyWriter() {
        return WRITER;
    }

    /**
     * Formats an instant the way the manifest stores timestamps: UTC, millisecond precision.
     */
    public static String timestamp(Instant instant) {
        return TIMESTAMP.format(instant);
    }
}
