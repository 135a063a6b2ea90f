package io.a2a.extras.taskengine.storage;

import io.a2a.extras.taskengine.model.Artifact;
import io.a2a.extras.taskengine.model.Context;
import io.a2a.extras.taskengine.model.Message;
import io.a2a.extras.taskengine.model.PushNotificationConfig;
import io.a2a.extras.taskengine.model.Task;
import io.a2a.extras.taskengine.model.TaskFeedback;
import io.a2a.extras.taskengine.model.TaskState;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Process-local backend. Mutations are serialized by one engine-wide write lock, which also keeps
 * {@link #clearContext(UUID)} from interleaving with an update of a task in that context. Stored
 * values are immutable records, so readers never observe a half-applied update.
 */
@Slf4j
public final class InMemoryStorage implements Storage {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    // insertion order doubles as creation order
    private final Map<UUID, Task> tasks = new LinkedHashMap<>();
    private final Map<UUID, Context> contexts = new LinkedHashMap<>();
    private final Map<UUID, List<TaskFeedback>> feedback = new LinkedHashMap<>();
    private final Map<UUID, PushNotificationConfig> webhookConfigs = new LinkedHashMap<>();
    private final Clock clock;

    public InMemoryStorage() {
        this(Clock.systemUTC());
    }

    public InMemoryStorage(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<Task> loadTask(UUID taskId, Integer historyLength) {
        PayloadValidator.validateLength(historyLength, "history_length");
        return read(() -> Optional.ofNullable(tasks.get(taskId)))
                .map(task -> StorageSupport.truncate(task, historyLength));
    }

    @Override
    public Task submitTask(UUID contextId, Message message) {
        StorageSupport.requireId(contextId, "context_id");
        PayloadValidator.validateMessage(message);
        return write(() -> {
            OffsetDateTime now = StorageSupport.now(clock);
            UUID taskId = StorageSupport.resolveTaskId(message);
            Task existing = tasks.get(taskId);
            Task task;
            if (existing != null) {
                task = StorageSupport.continueTask(existing, contextId, message, now);
                log.debug("Appended message to task {}", taskId);
            } else {
                contexts.computeIfAbsent(contextId, id -> StorageSupport.emptyContext(id, now));
                task = StorageSupport.newTask(taskId, contextId, message, now);
                log.debug("Created task {} in context {}", taskId, contextId);
            }
            tasks.put(taskId, task);
            return task;
        });
    }

    @Override
    public Task updateTask(UUID taskId, TaskState state, List<Artifact> newArtifacts, List<Message> newMessages,
                           Map<String, Object> metadata, TransitionRule rule) {
        StorageSupport.requireId(taskId, "task_id");
        PayloadValidator.validateArtifacts(newArtifacts);
        PayloadValidator.validateMessages(newMessages);
        return write(() -> {
            Task existing = tasks.get(taskId);
            if (existing == null) {
                throw NotFoundException.task(taskId);
            }
            Task updated = StorageSupport.applyUpdate(existing, state, newArtifacts, newMessages, metadata, rule,
                    StorageSupport.now(clock));
            tasks.put(taskId, updated);
            return updated;
        });
    }

    @Override
    public List<Task> listTasks(Integer length) {
        PayloadValidator.validateLength(length, "length");
        return read(() -> StorageSupport.limit(newestFirst(tasks.values()), length));
    }

    @Override
    public List<Task> listTasksByContext(UUID contextId, Integer length) {
        PayloadValidator.validateLength(length, "length");
        return read(() -> StorageSupport.limit(newestFirst(tasks.values().stream()
                .filter(task -> task.contextId().equals(contextId))
                .toList()), length));
    }

    @Override
    public List<Task> listTasksByContextAndState(UUID contextId, Set<TaskState> states, Integer length) {
        StorageSupport.requireStates(states);
        PayloadValidator.validateLength(length, "length");
        return read(() -> StorageSupport.limit(newestFirst(tasks.values().stream()
                .filter(task -> task.contextId().equals(contextId) && states.contains(task.state()))
                .toList()), length));
    }

    @Override
    public Optional<Context> loadContext(UUID contextId) {
        return read(() -> Optional.ofNullable(contexts.get(contextId)));
    }

    @Override
    public Context updateContext(UUID contextId, Context context) {
        StorageSupport.requireId(contextId, "context_id");
        if (context == null) {
            throw new ValidationException("Context cannot be null");
        }
        PayloadValidator.validateMessages(context.messageHistory());
        return write(() -> {
            Context stored = StorageSupport.replaceContext(contexts.get(contextId), contextId, context,
                    StorageSupport.now(clock));
            contexts.put(contextId, stored);
            return stored;
        });
    }

    @Override
    public Context appendToContext(UUID contextId, List<Message> messages) {
        StorageSupport.requireId(contextId, "context_id");
        PayloadValidator.validateMessages(messages);
        return write(() -> {
            OffsetDateTime now = StorageSupport.now(clock);
            Context existing = contexts.getOrDefault(contextId, StorageSupport.emptyContext(contextId, now));
            List<Message> stamped = messages == null ? List.of() : messages.stream()
                    .map(message -> message.addressedTo(message.taskId(), contextId, now))
                    .toList();
            Context updated = existing.appending(stamped, now);
            contexts.put(contextId, updated);
            return updated;
        });
    }

    @Override
    public List<Context> listContexts(Integer length) {
        PayloadValidator.validateLength(length, "length");
        return read(() -> StorageSupport.limit(newestFirst(contexts.values()), length));
    }

    @Override
    public void clearContext(UUID contextId) {
        write(() -> {
            List<UUID> taskIds = tasks.values().stream()
                    .filter(task -> task.contextId().equals(contextId))
                    .map(Task::id)
                    .toList();
            taskIds.forEach(taskId -> {
                tasks.remove(taskId);
                feedback.remove(taskId);
                webhookConfigs.remove(taskId);
            });
            if (contexts.remove(contextId) != null) {
                log.debug("Cleared context {} with {} tasks", contextId, taskIds.size());
            }
            return null;
        });
    }

    @Override
    public void clearAll() {
        write(() -> {
            tasks.clear();
            contexts.clear();
            feedback.clear();
            webhookConfigs.clear();
            return null;
        });
        log.info("Cleared all in-memory tasks and contexts");
    }

    @Override
    public void storeTaskFeedback(UUID taskId, Map<String, Object> feedbackData) {
        PayloadValidator.validateFeedback(feedbackData);
        write(() -> {
            if (!tasks.containsKey(taskId)) {
                throw NotFoundException.task(taskId);
            }
            feedback.computeIfAbsent(taskId, id -> new ArrayList<>())
                    .add(new TaskFeedback(UUID.randomUUID(), taskId, feedbackData, StorageSupport.now(clock)));
            return null;
        });
    }

    @Override
    public List<TaskFeedback> getTaskFeedback(UUID taskId) {
        return read(() -> List.copyOf(feedback.getOrDefault(taskId, List.of())));
    }

    @Override
    public void saveWebhookConfig(UUID taskId, PushNotificationConfig config) {
        StorageSupport.requireId(taskId, "task_id");
        if (config == null) {
            throw new ValidationException("Webhook config cannot be null");
        }
        write(() -> webhookConfigs.put(taskId, config));
    }

    @Override
    public Optional<PushNotificationConfig> loadWebhookConfig(UUID taskId) {
        return read(() -> Optional.ofNullable(webhookConfigs.get(taskId)));
    }

    @Override
    public void deleteWebhookConfig(UUID taskId) {
        write(() -> webhookConfigs.remove(taskId));
    }

    @Override
    public Map<UUID, PushNotificationConfig> loadAllWebhookConfigs() {
        return read(() -> Collections.unmodifiableMap(new LinkedHashMap<>(webhookConfigs)));
    }

    private static <T> List<T> newestFirst(Collection<T> values) {
        List<T> ordered = new ArrayList<>(values);
        Collections.reverse(ordered);
        return ordered;
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
