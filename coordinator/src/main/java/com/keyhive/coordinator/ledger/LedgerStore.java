package com.keyhive.coordinator.ledger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.keyhive.core.error.LedgerCorruptedException;
import com.keyhive.core.model.ProgressRecord;
import com.keyhive.core.util.JsonFileStore;

import java.math.BigInteger;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Durable ledger file: a JSON array of progress records.
 * <p>
 * Loading checks every record invariant. A file that parses but violates one
 * is as corrupt as one that does not parse.
 * </p>
 */
public class LedgerStore {
    private final JsonFileStore<List<ProgressRecord>> file;

    public LedgerStore(Path path) {
        this.file = new JsonFileStore<>(path, new TypeReference<List<ProgressRecord>>() {
        });
    }

    public Path path() {
        return file.path();
    }

    /**
     * @return stored records, or an empty list when no ledger exists yet
     * @throws LedgerCorruptedException when the file is unreadable or inconsistent
     */
    public List<ProgressRecord> load() {
        List<ProgressRecord> records = file.load().orElse(List.of());
        Set<String> ids = new HashSet<>();
        for (ProgressRecord record : records) {
            String problem = violation(record);
            if (problem != null) {
                throw new LedgerCorruptedException(file.path(), problem);
            }
            if (!ids.add(record.getRangeId())) {
                throw new LedgerCorruptedException(file.path(), "duplicate range id " + record.getRangeId());
            }
        }
        return records;
    }

    public void save(List<ProgressRecord> records) {
        file.save(records);
    }

    private static String violation(ProgressRecord record) {
        if (record == null) {
            return "null record";
        }
        String id = record.getRangeId();
        if (id == null || id.isBlank()) {
            return "record without range_id";
        }
        if (record.getStatus() == null) {
            return id + ": missing status";
        }
        BigInteger start = record.getStart();
        BigInteger end = record.getEnd();
        BigInteger total = record.getTotalKeys();
        BigInteger searched = record.getSearchedKeys();
        if (start == null || end == null || total == null || searched == null) {
            return id + ": missing bounds or counters";
        }
        if (start.signum() < 0 || start.compareTo(end) >= 0) {
            return id + ": start must be below end";
        }
        if (!total.equals(end.subtract(start))) {
            return id + ": total_keys does not match its bounds";
        }
        if (searched.signum() < 0 || searched.compareTo(total) > 0) {
            return id + ": searched_keys outside [0, total_keys]";
        }
        if (record.getPriority() < 0 || record.getPriority() > 100) {
            return id + ": priority outside [0, 100]";
        }
        return null;
    }
}
