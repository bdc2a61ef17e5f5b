package com.providersentinel.core.ingest;

/**
 * Raised when a required input source is missing or cannot be read.
 *
 * <p>
 * This is a fatal precondition failure for the whole run: it is thrown before
 * any detector executes and no partial report is produced. Individual rows
 * that fail to parse never raise it; they are skipped and counted instead.
 * </p>
 *
 * @since 1.0.0
 */
public class DatasetLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DatasetLoadException(String message) {
        super(message);
    }

    public DatasetLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
