package io.a2a.extras.taskengine.storage;

import java.util.UUID;

public class NotFoundException extends TaskStoreException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException task(UUID taskId) {
        return new NotFoundException("Task not found: " + taskId);
    }

    public static NotFoundException context(UUID contextId) {
        return new NotFoundException("Context not found: " + contextId);
    }
}
