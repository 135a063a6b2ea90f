package io.a2a.extras.taskengine.storage;

/**
 * Transient backend failure that survived the configured retries. Callers may retry.
 */
public class StorageUnavailableException extends TaskStoreException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
