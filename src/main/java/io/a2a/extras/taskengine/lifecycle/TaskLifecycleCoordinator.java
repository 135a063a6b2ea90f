package io.a2a.extras.taskengine.lifecycle;

import io.a2a.extras.taskengine.model.Artifact;
import io.a2a.extras.taskengine.model.Context;
import io.a2a.extras.taskengine.model.Message;
import io.a2a.extras.taskengine.model.MessageSendConfiguration;
import io.a2a.extras.taskengine.model.Task;
import io.a2a.extras.taskengine.model.TaskFeedback;
import io.a2a.extras.taskengine.model.TaskState;
import io.a2a.extras.taskengine.push.PushNotificationManager;
import io.a2a.extras.taskengine.storage.InvalidStateTransitionException;
import io.a2a.extras.taskengine.storage.NotFoundException;
import io.a2a.extras.taskengine.storage.PayloadValidator;
import io.a2a.extras.taskengine.storage.Storage;
import io.a2a.extras.taskengine.storage.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Applies the task state machine on top of a {@link Storage} backend and reports every transition
 * to the {@link PushNotificationManager}.
 * <p>
 * An inbound message continues a task when it names one, or when the context holds a task waiting
 * for input or authentication. Otherwise a new task is started; if the most recent task of the
 * context is finished, the new task's first message references it.
 */
@Slf4j
public class TaskLifecycleCoordinator {

    private static final Set<TaskState> INTERRUPTED = EnumSet.of(TaskState.INPUT_REQUIRED, TaskState.AUTH_REQUIRED);

    private final Storage storage;
    private final PushNotificationManager pushNotificationManager;

    public TaskLifecycleCoordinator(Storage storage, PushNotificationManager pushNotificationManager) {
        this.storage = storage;
        this.pushNotificationManager = pushNotificationManager;
    }

    public Task sendMessage(Message message) {
        return sendMessage(message, MessageSendConfiguration.DEFAULT);
    }

    public Task sendMessage(Message message, MessageSendConfiguration configuration) {
        PayloadValidator.validateMessage(message);
        MessageSendConfiguration options = configuration != null ? configuration : MessageSendConfiguration.DEFAULT;
        PayloadValidator.validateLength(options.historyLength(), "history_length");
        if (options.pushNotificationConfig() != null) {
            PushNotificationManager.normalize(options.pushNotificationConfig());
        }

        UUID contextId = message.contextId() != null ? message.contextId() : UUID.randomUUID();
        Optional<Task> target = resolveTarget(message, contextId);

        Task result;
        if (target.isPresent()) {
            result = continueTask(target.get(), message, contextId, options);
        } else {
            result = startTask(message, contextId, options);
        }
        storage.appendToContext(contextId, List.of(result.history().get(result.history().size() - 1)));
        return result.withHistoryLength(options.historyLength());
    }

    /**
     * Moves a task along the state machine, appending artifacts and messages produced by execution.
     */
    public Task transition(UUID taskId, TaskState state, List<Artifact> newArtifacts, List<Message> newMessages,
                           Map<String, Object> metadata) {
        if (state == null) {
            throw new ValidationException("state is required");
        }
        requireId(taskId);
        Task updated = storage.updateTask(taskId, state, newArtifacts, newMessages, metadata,
                TaskStateMachine::canTransition);
        log.debug("Task {} moved to {}", taskId, state.asString());
        if (newMessages != null && !newMessages.isEmpty()) {
            storage.appendToContext(updated.contextId(), tail(updated.history(), newMessages.size()));
        }
        pushNotificationManager.onTransition(updated, newArtifacts);
        return updated;
    }

    public Task transition(UUID taskId, TaskState state) {
        return transition(taskId, state, null, null, null);
    }

    public Task cancelTask(UUID taskId) {
        return transition(taskId, TaskState.CANCELED);
    }

    public Task getTask(UUID taskId, Integer historyLength) {
        return storage.loadTask(taskId, historyLength).orElseThrow(() -> NotFoundException.task(taskId));
    }

    public List<Task> listTasks(UUID contextId, Integer length) {
        return contextId == null ? storage.listTasks(length) : storage.listTasksByContext(contextId, length);
    }

    public void submitFeedback(UUID taskId, Integer rating, String comment, Map<String, Object> metadata) {
        Map<String, Object> feedback = new LinkedHashMap<>();
        feedback.put(TaskFeedback.RATING, rating);
        if (comment != null) {
            feedback.put(TaskFeedback.COMMENT, comment);
        }
        if (metadata != null && !metadata.isEmpty()) {
            feedback.put(TaskFeedback.METADATA, metadata);
        }
        storage.storeTaskFeedback(taskId, feedback);
        log.debug("Stored feedback for task {}", taskId);
    }

    public List<TaskFeedback> getFeedback(UUID taskId) {
        return storage.getTaskFeedback(taskId);
    }

    public Context createContext(UUID contextId, Map<String, Object> contextData) {
        UUID id = contextId != null ? contextId : UUID.randomUUID();
        Context existing = storage.loadContext(id).orElse(null);
        List<Message> history = existing != null ? existing.messageHistory() : List.of();
        return storage.updateContext(id, new Context(id, contextData, history, null, null));
    }

    public Context getContext(UUID contextId) {
        return storage.loadContext(contextId).orElseThrow(() -> NotFoundException.context(contextId));
    }

    public List<Context> listContexts(Integer length) {
        return storage.listContexts(length);
    }

    public void clearContext(UUID contextId) {
        List<UUID> taskIds = storage.listTasksByContext(contextId, null).stream().map(Task::id).toList();
        storage.clearContext(contextId);
        pushNotificationManager.forgetTasks(taskIds);
    }

    public void clearAll() {
        storage.clearAll();
        pushNotificationManager.forgetAll();
    }

    private Optional<Task> resolveTarget(Message message, UUID contextId) {
        if (message.taskId() != null) {
            Optional<Task> named = storage.loadTask(message.taskId());
            named.ifPresent(task -> {
                if (task.state().isFinal()) {
                    throw new InvalidStateTransitionException(task.id(), task.state(), TaskState.WORKING);
                }
                if (!task.contextId().equals(contextId)) {
                    throw new ValidationException("Task " + task.id() + " does not belong to context " + contextId);
                }
            });
            return named;
        }
        return storage.listTasksByContextAndState(contextId, INTERRUPTED, 1).stream().findFirst();
    }

    private Task continueTask(Task target, Message message, UUID contextId, MessageSendConfiguration options) {
        Message addressed = new Message.Builder(message).taskId(target.id()).contextId(contextId).build();
        log.debug("Message continues task {} in state {}", target.id(), target.state().asString());
        if (target.state().isInterrupted()) {
            // append and resume in one write, re-checked against the locked state
            Task resumed = storage.updateTask(target.id(), TaskState.WORKING, null, List.of(addressed), null,
                    TaskStateMachine::canTransition);
            registerSubscriber(resumed, options);
            pushNotificationManager.onTransition(resumed, List.of());
            return resumed;
        }
        Task appended = storage.submitTask(contextId, addressed);
        registerSubscriber(appended, options);
        return appended;
    }

    private Task startTask(Message message, UUID contextId, MessageSendConfiguration options) {
        Message addressed = new Message.Builder(message).contextId(contextId).build();
        Optional<Task> latest = storage.listTasksByContext(contextId, 1).stream().findFirst();
        if (message.taskId() == null && latest.isPresent() && latest.get().state().isFinal()) {
            addressed = addressed.withReferenceTaskId(latest.get().id());
        }
        Task created = storage.submitTask(contextId, addressed);
        registerSubscriber(created, options);
        log.debug("Started task {} in context {}", created.id(), contextId);
        pushNotificationManager.onTransition(created, List.of());
        return created;
    }

    private void registerSubscriber(Task task, MessageSendConfiguration options) {
        if (options.pushNotificationConfig() != null) {
            pushNotificationManager.register(task.id(), options.pushNotificationConfig(), true);
        }
    }

    private static void requireId(UUID taskId) {
        if (taskId == null) {
            throw new ValidationException("task_id is required");
        }
    }

    private static <T> List<T> tail(List<T> items, int count) {
        return items.subList(Math.max(0, items.size() - count), items.size());
    }
}
