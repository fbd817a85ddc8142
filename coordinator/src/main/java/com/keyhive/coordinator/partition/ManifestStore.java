package com.keyhive.coordinator.partition;

import com.keyhive.core.util.JsonFileStore;

import java.nio.file.Path;
import java.util.Optional;

/**
 * {@code manifest.json} in the coordinator's data directory.
 */
public class ManifestStore {
    private final JsonFileStore<Manifest> file;

    public ManifestStore(Path path) {
        this.file = new JsonFileStore<>(path, Manifest.class);
    }

    public Optional<Manifest> load() {
        return file.load();
    }

    public void save(Manifest manifest) {
        file.save(manifest);
    }
}
