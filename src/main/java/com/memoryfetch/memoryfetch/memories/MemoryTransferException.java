package com.memoryfetch.memoryfetch.memories;

/**
 * A single transfer attempt failed; the executor decides whether to retry.
 */
public class MemoryTransferException extends RuntimeException {

    public MemoryTransferException(String message) {
        super(message);
    }

    public MemoryTransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
