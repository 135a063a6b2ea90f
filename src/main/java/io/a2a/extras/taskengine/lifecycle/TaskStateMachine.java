package io.a2a.extras.taskengine.lifecycle;

import io.a2a.extras.taskengine.model.TaskState;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Allowed task state edges:
 * <pre>
 * submitted      -> working
 * working        -> completed | failed | canceled | input-required | auth-required
 * input-required -> working
 * auth-required  -> working
 * </pre>
 * Any non-final state may also move to {@code canceled} or stay where it is. Final states have no edges.
 */
public final class TaskStateMachine {

    private static final Map<TaskState, Set<TaskState>> EDGES = new EnumMap<>(TaskState.class);

    static {
        EDGES.put(TaskState.SUBMITTED, EnumSet.of(TaskState.WORKING));
        EDGES.put(TaskState.WORKING, EnumSet.of(TaskState.COMPLETED, TaskState.FAILED, TaskState.CANCELED,
                TaskState.INPUT_REQUIRED, TaskState.AUTH_REQUIRED));
        EDGES.put(TaskState.INPUT_REQUIRED, EnumSet.of(TaskState.WORKING));
        EDGES.put(TaskState.AUTH_REQUIRED, EnumSet.of(TaskState.WORKING));
    }

    private TaskStateMachine() {
    }

    public static boolean canTransition(TaskState from, TaskState to) {
        if (from == null || to == null || from.isFinal()) {
            return false;
        }
        if (from == to || to == TaskState.CANCELED) {
            return true;
        }
        return EDGES.getOrDefault(from, Set.of()).contains(to);
    }
}
