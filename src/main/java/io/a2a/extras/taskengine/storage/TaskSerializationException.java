package io.a2a.extras.taskengine.storage;

public class TaskSerializationException extends TaskStoreException {

    public TaskSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
