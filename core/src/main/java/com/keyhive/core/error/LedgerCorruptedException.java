package com.keyhive.core.error;

import java.nio.file.Path;

/**
 * A persisted file exists but cannot be read back. Never treated as empty:
 * the operator has to repair or move the file.
 */
public class LedgerCorruptedException extends KeyspaceException {

    public LedgerCorruptedException(Path path, String detail, Throwable cause) {
        super("Corrupt state file " + path + ": " + detail, cause);
    }

    public LedgerCorruptedException(Path path, String detail) {
        this(path, detail, null);
    }
}
