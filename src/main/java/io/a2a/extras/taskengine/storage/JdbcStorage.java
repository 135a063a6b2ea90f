package io.a2a.extras.taskengine.storage;

import io.a2a.extras.taskengine.jdbc.JdbcOperationExecutor;
import io.a2a.extras.taskengine.model.Artifact;
import io.a2a.extras.taskengine.model.Context;
import io.a2a.extras.taskengine.model.Message;
import io.a2a.extras.taskengine.model.PushNotificationConfig;
import io.a2a.extras.taskengine.model.Task;
import io.a2a.extras.taskengine.model.TaskFeedback;
import io.a2a.extras.taskengine.model.TaskState;
import io.a2a.extras.taskengine.repository.ContextRepository;
import io.a2a.extras.taskengine.repository.FeedbackRepository;
import io.a2a.extras.taskengine.repository.TaskRepository;
import io.a2a.extras.taskengine.repository.WebhookConfigRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Relational backend. Scalar columns carry ids, state and timestamps; history, artifacts, metadata
 * and context data are JSON documents. Every mutation runs in one transaction that locks the task
 * row ({@code SELECT ... FOR UPDATE}) before reading it, so concurrent appends are serialized and
 * {@link #clearContext(UUID)} waits for in-flight updates of its tasks.
 * <p>
 * Tasks in a final state never change again and are served from {@code finalizedTasks} when a
 * cache is configured.
 */
@Slf4j
public final class JdbcStorage implements Storage {

    private final TaskRepository taskRepository;
    private final ContextRepository contextRepository;
    private final FeedbackRepository feedbackRepository;
    private final WebhookConfigRepository webhookConfigRepository;
    private final JdbcOperationExecutor executor;
    private final Cache finalizedTasks;
    private final Clock clock;
    private final AutoCloseable ownedResource;

    public JdbcStorage(TaskRepository taskRepository,
                       ContextRepository contextRepository,
                       FeedbackRepository feedbackRepository,
                       WebhookConfigRepository webhookConfigRepository,
                       JdbcOperationExecutor executor,
                       Cache finalizedTasks,
                       Clock clock,
                       AutoCloseable ownedResource) {
        this.taskRepository = taskRepository;
        this.contextRepository = contextRepository;
        this.feedbackRepository = feedbackRepository;
        this.webhookConfigRepository = webhookConfigRepository;
        this.executor = executor;
        this.finalizedTasks = finalizedTasks;
        this.clock = clock;
        this.ownedResource = ownedResource;
    }

    @Override
    public Optional<Task> loadTask(UUID taskId, Integer historyLength) {
        PayloadValidator.validateLength(historyLength, "history_length");
        Task cached = cachedTask(taskId);
        if (cached != null) {
            return Optional.of(StorageSupport.truncate(cached, historyLength));
        }
        Optional<Task> task = executor.read("loadTask", status -> taskRepository.findById(taskId));
        task.ifPresent(this::cacheIfFinal);
        return task.map(t -> StorageSupport.truncate(t, historyLength));
    }

    @Override
    public Task submitTask(UUID contextId, Message message) {
        StorageSupport.requireId(contextId, "context_id");
        PayloadValidator.validateMessage(message);
        UUID taskId = StorageSupport.resolveTaskId(message);
        return executor.write("submitTask", status -> {
            OffsetDateTime now = StorageSupport.now(clock);
            Optional<Task> existing = taskRepository.findByIdForUpdate(taskId);
            if (existing.isPresent()) {
                Task continued = StorageSupport.continueTask(existing.get(), contextId, message, now);
                taskRepository.update(continued);
                log.debug("Appended message to task {}", taskId);
                return continued;
            }
            contextRepository.insertIfAbsent(StorageSupport.emptyContext(contextId, now));
            Task created = StorageSupport.newTask(taskId, contextId, message, now);
            taskRepository.insert(created);
            log.debug("Created task {} in context {}", taskId, contextId);
            return created;
        });
    }

    @Override
    public Task updateTask(UUID taskId, TaskState state, List<Artifact> newArtifacts, List<Message> newMessages,
                           Map<String, Object> metadata, TransitionRule rule) {
        StorageSupport.requireId(taskId, "task_id");
        PayloadValidator.validateArtifacts(newArtifacts);
        PayloadValidator.validateMessages(newMessages);
        Task cached = cachedTask(taskId);
        if (cached != null) {
            throw new InvalidStateTransitionException(taskId, cached.state(), state);
        }
        Task updated = executor.write("updateTask", status -> {
            Task existing = taskRepository.findByIdForUpdate(taskId)
                    .orElseThrow(() -> NotFoundException.task(taskId));
            Task next = StorageSupport.applyUpdate(existing, state, newArtifacts, newMessages, metadata, rule,
                    StorageSupport.now(clock));
            taskRepository.update(next);
            return next;
        });
        cacheIfFinal(updated);
        return updated;
    }

    @Override
    public List<Task> listTasks(Integer length) {
        PayloadValidator.validateLength(length, "length");
        return executor.read("listTasks", status -> taskRepository.findAll(length));
    }

    @Override
    public List<Task> listTasksByContext(UUID contextId, Integer length) {
        PayloadValidator.validateLength(length, "length");
        return executor.read("listTasksByContext", status -> taskRepository.findByContextId(contextId, length));
    }

    @Override
    public List<Task> listTasksByContextAndState(UUID contextId, Set<TaskState> states, Integer length) {
        StorageSupport.requireStates(states);
        PayloadValidator.validateLength(length, "length");
        return executor.read("listTasksByContextAndState",
                status -> taskRepository.findByContextIdAndStates(contextId, states, length));
    }

    @Override
    public Optional<Context> loadContext(UUID contextId) {
        return executor.read("loadContext", status -> contextRepository.findById(contextId));
    }

    @Override
    public Context updateContext(UUID contextId, Context context) {
        StorageSupport.requireId(contextId, "context_id");
        if (context == null) {
            throw new ValidationException("Context cannot be null");
        }
        PayloadValidator.validateMessages(context.messageHistory());
        return executor.write("updateContext", status -> {
            OffsetDateTime now = StorageSupport.now(clock);
            Context stored = StorageSupport.replaceContext(null, contextId, context, now);
            if (contextRepository.insertIfAbsent(stored)) {
                return stored;
            }
            Context existing = contextRepository.findByIdForUpdate(contextId)
                    .orElseThrow(() -> NotFoundException.context(contextId));
            Context replaced = StorageSupport.replaceContext(existing, contextId, context, now);
            contextRepository.update(replaced);
            return replaced;
        });
    }

    @Override
    public Context appendToContext(UUID contextId, List<Message> messages) {
        StorageSupport.requireId(contextId, "context_id");
        PayloadValidator.validateMessages(messages);
        return executor.write("appendToContext", status -> {
            OffsetDateTime now = StorageSupport.now(clock);
            contextRepository.insertIfAbsent(StorageSupport.emptyContext(contextId, now));
            Context existing = contextRepository.findByIdForUpdate(contextId)
                    .orElseThrow(() -> NotFoundException.context(contextId));
            List<Message> stamped = messages == null ? List.of() : messages.stream()
                    .map(message -> message.addressedTo(message.taskId(), contextId, now))
                    .toList();
            Context updated = existing.appending(stamped, now);
            contextRepository.update(updated);
            return updated;
        });
    }

    @Override
    public List<Context> listContexts(Integer length) {
        PayloadValidator.validateLength(length, "length");
        return executor.read("listContexts", status -> contextRepository.findAll(length));
    }

    @Override
    public void clearContext(UUID contextId) {
        List<UUID> removed = executor.write("clearContext", status -> {
            if (contextRepository.findByIdForUpdate(contextId).isEmpty()) {
                return List.<UUID>of();
            }
            List<UUID> taskIds = taskRepository.lockIdsByContextId(contextId);
            webhookConfigRepository.deleteByContextId(contextId);
            taskRepository.deleteByContextId(contextId);
            contextRepository.delete(contextId);
            return taskIds;
        });
        if (finalizedTasks != null) {
            removed.forEach(finalizedTasks::evict);
        }
        log.debug("Cleared context {} with {} tasks", contextId, removed.size());
    }

    @Override
    public void clearAll() {
        executor.write("clearAll", status -> {
            webhookConfigRepository.deleteAll();
            taskRepository.deleteAll();
            contextRepository.deleteAll();
            return null;
        });
        if (finalizedTasks != null) {
            finalizedTasks.clear();
        }
        log.info("Cleared all persisted tasks and contexts");
    }

    @Override
    public void storeTaskFeedback(UUID taskId, Map<String, Object> feedbackData) {
        PayloadValidator.validateFeedback(feedbackData);
        executor.write("storeTaskFeedback", status -> {
            taskRepository.findById(taskId).orElseThrow(() -> NotFoundException.task(taskId));
            feedbackRepository.insert(new TaskFeedback(UUID.randomUUID(), taskId, feedbackData, StorageSupport.now(clock)));
            return null;
        });
    }

    @Override
    public List<TaskFeedback> getTaskFeedback(UUID taskId) {
        return executor.read("getTaskFeedback", status -> feedbackRepository.findByTaskId(taskId));
    }

    @Override
    public void saveWebhookConfig(UUID taskId, PushNotificationConfig config) {
        StorageSupport.requireId(taskId, "task_id");
        if (config == null) {
            throw new ValidationException("Webhook config cannot be null");
        }
        executor.write("saveWebhookConfig", status -> {
            webhookConfigRepository.save(taskId, config, StorageSupport.now(clock));
            return null;
        });
    }

    @Override
    public Optional<PushNotificationConfig> loadWebhookConfig(UUID taskId) {
        return executor.read("loadWebhookConfig", status -> webhookConfigRepository.findByTaskId(taskId));
    }

    @Override
    public void deleteWebhookConfig(UUID taskId) {
        executor.write("deleteWebhookConfig", status -> {
            webhookConfigRepository.delete(taskId);
            return null;
        });
    }

    @Override
    public Map<UUID, PushNotificationConfig> loadAllWebhookConfigs() {
        return executor.read("loadAllWebhookConfigs", status -> webhookConfigRepository.findAll());
    }

    @Override
    public void close() {
        if (ownedResource == null) {
            return;
        }
        try {
            ownedResource.close();
            log.info("Closed A2A task engine connection pool");
        } catch (Exception e) {
            throw new TaskStoreException("Failed to close connection pool", e);
        }
    }

    private Task cachedTask(UUID taskId) {
        return finalizedTasks == null ? null : finalizedTasks.get(taskId, Task.class);
    }

    private void cacheIfFinal(Task task) {
        if (finalizedTasks != null && task.state().isFinal()) {
            finalizedTasks.put(task.id(), task);
        }
    }
}
