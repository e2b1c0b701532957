package io.mcoda.util;

/**
 * A filesystem read or write against job, manifest or lane storage failed.
 */
public class StorageIoException extends RuntimeException {
    public StorageIoException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageIoException(String message) {
        super(message);
    }
}
