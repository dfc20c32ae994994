package com.memoryfetch.memoryfetch.memories;

/**
 * Fatal precondition failure: the export or the run configuration cannot be used.
 */
public class MemoryExportException extends IllegalStateException {

    public MemoryExportException(String message) {
        super(message);
    }

    public MemoryExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
