package io.aggregator.source;

import io.aggregator.core.RowSource;
import io.aggregator.core.RowSourceProvider;
import io.aggregator.error.SourceNotFoundException;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

public class FileRowSourceProvider implements RowSourceProvider {
    private final Charset charset;
    private final CsvParserFactory parsers;

    public FileRowSourceProvider() {
        this(StandardCharsets.UTF_8, new CsvParserFactory());
    }

    public FileRowSourceProvider(Charset charset, CsvParserFactory parsers) {
        this.charset = charset;
        this.parsers = parsers;
    }

    @Override
    public RowSource open(String location) throws SourceNotFoundException {
        Path path;
        try {
            path = Path.of(location);
        } catch (InvalidPathException e) {
            throw new SourceNotFoundException(location, e);
        }
        return open(path);
    }

    public RowSource open(Path path) throws SourceNotFoundException {
        String location = path.toString();
        if (!Files.exists(path)) throw new SourceNotFoundException(location, "no such file");
        if (Files.isDirectory(path)) throw new SourceNotFoundException(location, "is a directory");
        try {
            BufferedReader reader = Files.newBufferedReader(path, charset);
            return new CsvRowSource(reader, location, parsers);
        } catch (IOException e) {
            throw new SourceNotFoundException(location, e);
        }
    }
}
