package com.migratorx.cli.infrastructure.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads JSON snapshot files into typed values.
 *
 * <p>Failures surface as {@link IOException}s with the path in the message; the calling
 * inspector's check turns them into findings.
 */
final class JsonFileReader {

    private final ObjectMapper mapper;

    JsonFileReader(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper must not be null");
        }
        this.mapper = mapper;
    }

    <T> T read(Path path, Class<T> type) throws IOException {
        if (path == null) {
            throw new IOException("file path is required");
        }
        try {
            byte[] content = Files.readAllBytes(path);
            if (content.length == 0) {
                throw new IOException("file is empty: " + path);
            }
            return mapper.readValue(content, type);
        } catch (NoSuchFileException e) {
            throw new IOException("file not found: " + path, e);
        }
    }
}
