package io.a2a.extras.taskengine.storage;

import io.a2a.extras.taskengine.model.TaskState;

import java.util.UUID;

/**
 * Raised when a task is mutated after reaching a final state, or when a requested
 * transition is not an edge of the task state machine.
 */
public class InvalidStateTransitionException extends TaskStoreException {

    private final UUID taskId;
    private final TaskState currentState;
    private final TaskState requestedState;

    public InvalidStateTransitionException(UUID taskId, TaskState currentState, TaskState requestedState) {
        super(describe(taskId, currentState, requestedState));
        this.taskId = taskId;
        this.currentState = currentState;
        this.requestedState = requestedState;
    }

    public UUID getTaskId() {
        return taskId;
    }

    public TaskState getCurrentState() {
        return currentState;
    }

    public TaskState getRequestedState() {
        return requestedState;
    }

    private static String describe(UUID taskId, TaskState currentState, TaskState requestedState) {
        if (currentState.isFinal()) {
            return "Task " + taskId + " is in final state " + currentState.asString() + " and cannot be modified";
        }
        return "Task " + taskId + " cannot transition from " + currentState.asString()
                + " to " + (requestedState == null ? "null" : requestedState.asString());
    }
}
