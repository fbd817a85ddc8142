package com.keyhive.participant.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.keyhive.core.util.JsonFileStore;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Append-only {@code pool_progress.json}, keeping the most recent entries only.
 */
public class ProgressHistory {
    public static final int DEFAULT_CAPACITY = 100;

    private final JsonFileStore<List<ProgressEntry>> file;
    private final int capacity;

    public ProgressHistory(Path path) {
        this(path, DEFAULT_CAPACITY);
    }

    public ProgressHistory(Path path, int capacity) {
        this.file = new JsonFileStore<>(path, new TypeReference<List<ProgressEntry>>() {
        });
        this.capacity = capacity;
    }

    public synchronized void append(ProgressEntry entry) {
        List<ProgressEntry> entries = new ArrayList<>(entries());
        entries.add(entry);
        if (entries.size() > capacity) {
            entries = new ArrayList<>(entries.subList(entries.size() - capacity, entries.size()));
        }
        file.save(entries);
    }

    /**
     * Oldest first.
     */
    public synchronized List<ProgressEntry> entries() {
        return file.load().orElse(List.of());
    }

    public Optional<ProgressEntry> latest() {
        List<ProgressEntry> entries = entries();
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
    }
}
