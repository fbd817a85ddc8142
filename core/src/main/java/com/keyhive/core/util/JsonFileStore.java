package com.keyhive.core.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.keyhive.core.error.KeyspaceException;
import com.keyhive.core.error.LedgerCorruptedException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * One JSON document on disk, replaced atomically on every save.
 * <p>
 * A missing file reads as empty. A file that exists but cannot be parsed is
 * never treated as empty: it raises {@link LedgerCorruptedException}.
 * </p>
 *
 * @param <T> document type
 */
public class JsonFileStore<T> {
    private final Path file;
    private final JavaType type;

    public JsonFileStore(Path file, TypeReference<T> type) {
        this.file = file;
        this.type = JsonUtils.mapper().getTypeFactory().constructType(type);
    }

    public JsonFileStore(Path file, Class<T> clazz) {
        this.file = file;
        this.type = JsonUtils.mapper().getTypeFactory().constructType(clazz);
    }

    public Path path() {
        return file;
    }

    public Optional<T> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        T value;
        try {
            value = JsonUtils.mapper().readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new LedgerCorruptedException(file, JsonUtils.rootMessage(e), e);
        }
        if (value == null) {
            throw new LedgerCorruptedException(file, "document is empty");
        }
        return Optional.of(value);
    }

    public synchronized void save(T value) {
        try {
            JsonUtils.writeFileAtomically(file, value);
        } catch (IOException e) {
            throw new KeyspaceException("Failed to write " + file, e);
        }
    }
}
