package com.keyhive.coordinator.schedule;

import com.keyhive.core.util.JsonFileStore;

import java.nio.file.Path;
import java.util.Optional;

public class StrategyStore {
    private final JsonFileStore<AdaptiveStrategy> file;

    public StrategyStore(Path path) {
        this.file = new JsonFileStore<>(path, AdaptiveStrategy.class);
    }

    public Optional<AdaptiveStrategy> load() {
        return file.load();
    }

    public void save(AdaptiveStrategy strategy) {
        file.save(strategy);
    }
}
