package io.a2a.extras.taskengine.handler;

import io.a2a.extras.taskengine.lifecycle.TaskLifecycleCoordinator;
import io.a2a.extras.taskengine.model.Context;
import io.a2a.extras.taskengine.model.PushNotificationConfig;
import io.a2a.extras.taskengine.model.Task;
import io.a2a.extras.taskengine.model.TaskPushNotificationConfig;
import io.a2a.extras.taskengine.push.PushNotificationManager;
import io.a2a.extras.taskengine.storage.NotFoundException;
import io.a2a.extras.taskengine.storage.ValidationException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Typed entry points for the protocol methods, one per JSON-RPC method.
 */
public class A2aRequestHandler {

    private final TaskLifecycleCoordinator coordinator;
    private final PushNotificationManager pushNotificationManager;

    public A2aRequestHandler(TaskLifecycleCoordinator coordinator, PushNotificationManager pushNotificationManager) {
        this.coordinator = coordinator;
        this.pushNotificationManager = pushNotificationManager;
    }

    public Task onMessageSend(MessageSendParams params) {
        if (params.message() == null) {
            throw new ValidationException("message is required");
        }
        return coordinator.sendMessage(params.message(), params.configuration());
    }

    public Task onGetTask(TaskQueryParams params) {
        return coordinator.getTask(requireTaskId(params.taskId()), params.historyLength());
    }

    public List<Task> onListTasks(TaskListParams params) {
        return coordinator.listTasks(params.contextId(), params.length());
    }

    public Task onCancelTask(TaskIdParams params) {
        return coordinator.cancelTask(requireTaskId(params.taskId()));
    }

    public Map<String, Object> onTaskFeedback(TaskFeedbackParams params) {
        UUID taskId = requireTaskId(params.taskId());
        if (params.rating() == null) {
            throw new ValidationException("rating is required");
        }
        coordinator.submitFeedback(taskId, params.rating(), params.comment(), params.metadata());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("message", "Feedback submitted successfully");
        result.put("task_id", taskId);
        return result;
    }

    public TaskPushNotificationConfig onSetPushNotificationConfig(TaskPushNotificationConfig params) {
        UUID taskId = requireTaskId(params.taskId());
        coordinator.getTask(taskId, 0);
        PushNotificationConfig registered = pushNotificationManager.register(taskId, params.pushNotificationConfig(), true);
        return new TaskPushNotificationConfig(taskId, registered);
    }

    public TaskPushNotificationConfig onGetPushNotificationConfig(TaskIdParams params) {
        UUID taskId = requireTaskId(params.taskId());
        return pushNotificationManager.get(taskId)
                .map(config -> new TaskPushNotificationConfig(taskId, config))
                .orElseThrow(() -> new NotFoundException("No push notification config for task " + taskId));
    }

    public List<TaskPushNotificationConfig> onListPushNotificationConfigs(TaskIdParams params) {
        return pushNotificationManager.list(params.taskId());
    }

    public Map<String, Object> onDeletePushNotificationConfig(TaskIdParams params) {
        UUID taskId = requireTaskId(params.taskId());
        boolean deleted = pushNotificationManager.delete(taskId);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("task_id", taskId);
        result.put("deleted", deleted);
        return result;
    }

    public Context onCreateContext(ContextParams params) {
        return coordinator.createContext(params.contextId(), params.contextData());
    }

    public Context onGetContext(ContextParams params) {
        if (params.contextId() == null) {
            throw new ValidationException("context_id is required");
        }
        return coordinator.getContext(params.contextId());
    }

    public List<Context> onListContexts(ContextParams params) {
        return coordinator.listContexts(params.length());
    }

    /**
     * Without a {@code context_id} every context and task is removed.
     */
    public Map<String, Object> onClearContexts(ContextParams params) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (params.contextId() == null) {
            coordinator.clearAll();
            result.put("message", "All contexts cleared");
        } else {
            coordinator.clearContext(params.contextId());
            result.put("message", "Context cleared");
            result.put("context_id", params.contextId());
        }
        return result;
    }

    private static UUID requireTaskId(UUID taskId) {
        if (taskId == null) {
            throw new ValidationException("task_id is required");
        }
        return taskId;
    }
}
