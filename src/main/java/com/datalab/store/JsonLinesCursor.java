package com.datalab.store;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.ToLongFunction;

/**
 * Reads one JSON record per line, lazily, enforcing strictly ascending ids across the whole file.
 */
class JsonLinesCursor<T> implements RecordCursor<T> {
    private final Path path;
    private final BufferedReader reader;
    private final LineDecoder<T> decoder;
    private final Predicate<T> filter;
    private final ToLongFunction<T> idExtractor;
    private long lineNumber;
    private long lastId = Long.MIN_VALUE;

    JsonLinesCursor(Path path, LineDecoder<T> decoder, Predicate<T> filter, ToLongFunction<T> idExtractor)
            throws IOException {
        this.path = path;
        this.reader = Files.exists(path) ? Files.newBufferedReader(path, StandardCharsets.UTF_8) : null;
        this.decoder = decoder;
        this.filter = filter;
        this.idExtractor = idExtractor;
    }

    @Override
    public Optional<T> next() throws IOException {
        if (reader == null) {
            return Optional.empty();
        }
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            T record;
            try {
                record = decoder.decode(line);
            } catch (IOException e) {
                throw new IOException("Malformed record at " + path + ":" + lineNumber, e);
            }
            long id = idExtractor.applyAsLong(record);
            if (id <= lastId) {
                throw new IOException("Records out of ascending id order at " + path + ":" + lineNumber
                        + " (id " + id + " after " + lastId + ")");
            }
            lastId = id;
            if (filter.test(record)) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    @Override
    public void close() throws IOException {
        if (reader != null) {
            reader.close();
        }
    }

    @FunctionalInterface
    interface LineDecoder<T> {
        T decode(String line) throws IOException;
    }
}
