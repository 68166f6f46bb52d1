package net.seitter.heapstore.storage;

import java.io.IOException;

/**
 * Signals a failure inside the storage core. The {@link ErrorKind} tells callers
 * whether the condition is a bug, corruption or resource exhaustion.
 */
public class StorageException extends IOException {
    private final ErrorKind kind;

    public StorageException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StorageException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Gets the kind of failure.
     *
     * @return The error kind
     */
    public ErrorKind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return "StorageException[" + kind + "]: " + getMessage();
    }
}
