package io.a2a.extras.taskengine.storage;

public class ValidationException extends TaskStoreException {

    public ValidationException(String message) {
        super(message);
    }
}
