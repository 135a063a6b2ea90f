package io.a2a.extras.taskengine.storage;

/**
 * Base type for every failure raised by a {@link Storage} backend or the lifecycle layer on top of it.
 */
public class TaskStoreException extends RuntimeException {

    public TaskStoreException(String message) {
        super(message);
    }

    public TaskStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
