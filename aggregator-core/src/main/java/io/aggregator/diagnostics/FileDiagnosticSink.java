package io.aggregator.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;

/**
 * Appends one JSON object per event to a file (JSON lines).
 */
public class FileDiagnosticSink implements DiagnosticSink {
    private static final Logger log = LoggerFactory.getLogger(FileDiagnosticSink.class);

    private final Path file;

    public FileDiagnosticSink(Path file) throws IOException {
        this.file = file;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    public Path file() { return file; }

    @Override
    public synchronized void accept(DiagnosticEvent event) {
        StringBuilder json = new StringBuilder(128)
                .append("{\"ts\":\"").append(Instant.now()).append('"')
                .append(",\"level\":\"").append(event.level()).append('"')
                .append(",\"message\":\"").append(escape(event.message())).append('"');
        if (event.hasRow()) {
            json.append(",\"row\":").append(event.rowNumber());
        }
        if (event.rawRow() != null) {
            json.append(",\"raw\":").append(toJsonArray(event.rawRow()));
        }
        json.append("}\n");
        try {
            Files.writeString(file, json, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("Could not append diagnostic to {}: {}", file, e.getMessage());
        }
    }

    private static String toJsonArray(List<String> values) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sb.append(',');
            String v = values.get(i);
            if (v == null) sb.append("null");
            else sb.append('"').append(escape(v)).append('"');
        }
        return sb.append(']').toString();
    }

    static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) sb.append(String.format("\\u%04x", (int) c));
                    else sb.append(c);
                }
            }
        }
        return sb.toString();
    }
}
