package com.keyhive.coordinator.pool;

import com.fasterxml.jackson.core.type.TypeReference;
import com.keyhive.core.error.ValidationException;
import com.keyhive.core.keyspace.KeyRange;
import com.keyhive.core.model.Assignment;
import com.keyhive.core.model.AssignmentStatus;
import com.keyhive.core.util.JsonFileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Every assignment the coordinator has handed out, persisted to {@code assignments.json}.
 * <p>
 * Callers serialize mutations (the coordinator holds its claim lock); reads are lock-free.
 * </p>
 */
public class AssignmentRegistry {
    private static final Logger log = LoggerFactory.getLogger(AssignmentRegistry.class);

    private final JsonFileStore<List<Assignment>> store;
    private final Map<String, Assignment> assignments = new ConcurrentHashMap<>();

    public AssignmentRegistry(Path file) {
        this.store = new JsonFileStore<>(file, new TypeReference<List<Assignment>>() {
        });
    }

    public void load() {
        assignments.clear();
        store.load().orElse(List.of()).forEach(a -> assignments.put(a.getAssignmentId(), a));
        log.info("Loaded {} assignments from {}", assignments.size(), store.path());
    }

    public Optional<Assignment> get(String assignmentId) {
        return Optional.ofNullable(assignmentId == null ? null : assignments.get(assignmentId));
    }

    /**
     * @throws ValidationException when the id is unknown
     */
    public Assignment require(String assignmentId) {
        return get(assignmentId)
            .orElseThrow(() -> new ValidationException("Unknown assignment id: " + assignmentId));
    }

    public Assignment put(Assignment assignment) {
        Assignment previous = assignments.put(assignment.getAssignmentId(), assignment);
        try {
            store.save(all());
        } catch (RuntimeException e) {
            if (previous == null) {
                assignments.remove(assignment.getAssignmentId());
            } else {
                assignments.put(previous.getAssignmentId(), previous);
            }
            throw e;
        }
        return assignment;
    }

    /**
     * All assignments, oldest first.
     */
    public List<Assignment> all() {
        return assignments.values().stream()
            .sorted(Comparator.comparing(Assignment::getAssignedAt).thenComparing(Assignment::getAssignmentId))
            .collect(Collectors.toList());
    }

    public List<Assignment> liveAt(Instant now) {
        return assignments.values().stream()
            .filter(a -> a.isLiveAt(now))
            .collect(Collectors.toList());
    }

    /**
     * Live assignments over intervals overlapping {@code range}, other than {@code exceptId}.
     */
    public List<Assignment> liveOverlapping(KeyRange range, Instant now, String exceptId) {
        return assignments.values().stream()
            .filter(a -> a.isLiveAt(now))
            .filter(a -> !a.getAssignmentId().equals(exceptId))
            .filter(a -> a.keyRange().overlaps(range))
            .collect(Collectors.toList());
    }

    /**
     * Still marked assigned or reporting although the lease ran out.
     */
    public List<Assignment> overdueAt(Instant now) {
        return assignments.values().stream()
            .filter(a -> !a.getStatus().isTerminal() && a.getStatus() != AssignmentStatus.EXPIRED)
            .filter(a -> a.getExpiresAt() != null && !now.isBefore(a.getExpiresAt()))
            .collect(Collectors.toList());
    }
}
