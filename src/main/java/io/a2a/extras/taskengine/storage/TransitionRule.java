package io.a2a.extras.taskengine.storage;

import io.a2a.extras.taskengine.model.TaskState;

/**
 * Edge check applied by {@link Storage#updateTask} to the locked copy of a task, so the decision
 * and the write see the same state.
 */
@FunctionalInterface
public interface TransitionRule {

    /**
     * Accepts every move out of a non-final state.
     */
    TransitionRule ANY = (from, to) -> true;

    boolean allows(TaskState from, TaskState to);
}
