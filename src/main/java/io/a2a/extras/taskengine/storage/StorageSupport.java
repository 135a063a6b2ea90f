package io.a2a.extras.taskengine.storage;

import io.a2a.extras.taskengine.model.Artifact;
import io.a2a.extras.taskengine.model.Context;
import io.a2a.extras.taskengine.model.Message;
import io.a2a.extras.taskengine.model.Task;
import io.a2a.extras.taskengine.model.TaskState;
import io.a2a.extras.taskengine.model.TaskStatus;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Task mutation rules shared by both backends. Every method is pure: it returns the new
 * value and leaves persisting it to the caller, which holds the lock or transaction.
 */
final class StorageSupport {

    private StorageSupport() {
    }

    /**
     * Database timestamp columns keep microseconds, so both backends truncate to them.
     */
    static OffsetDateTime now(Clock clock) {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
    }

    static UUID resolveTaskId(Message message) {
        return message.taskId() != null ? message.taskId() : UUID.randomUUID();
    }

    static Task newTask(UUID taskId, UUID contextId, Message message, OffsetDateTime now) {
        return new Task.Builder()
                .id(taskId)
                .contextId(contextId)
                .status(new TaskStatus(TaskState.SUBMITTED, now))
                .history(List.of(message.addressedTo(taskId, contextId, now)))
                .artifacts(List.of())
                .metadata(Map.of())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    static Task continueTask(Task existing, UUID contextId, Message message, OffsetDateTime now) {
        requireMutable(existing, null);
        if (!existing.contextId().equals(contextId)) {
            throw new ValidationException("Task " + existing.id() + " belongs to context " + existing.contextId()
                    + ", not " + contextId);
        }
        return new Task.Builder(existing)
                .history(append(existing.history(), stamp(List.of(message), existing, now)))
                .updatedAt(now)
                .build();
    }

    static Task applyUpdate(Task existing, TaskState state, List<Artifact> newArtifacts, List<Message> newMessages,
                            Map<String, Object> metadata, TransitionRule rule, OffsetDateTime now) {
        requireMutable(existing, state);
        if (state != null && rule != null && !rule.allows(existing.state(), state)) {
            throw new InvalidStateTransitionException(existing.id(), existing.state(), state);
        }
        Task.Builder builder = new Task.Builder(existing).updatedAt(now);
        if (state != null) {
            builder.status(new TaskStatus(state, now));
        }
        if (newArtifacts != null && !newArtifacts.isEmpty()) {
            builder.artifacts(append(existing.artifacts(), newArtifacts));
        }
        if (newMessages != null && !newMessages.isEmpty()) {
            builder.history(append(existing.history(), stamp(newMessages, existing, now)));
        }
        if (metadata != null && !metadata.isEmpty()) {
            builder.metadata(mergeMetadata(existing.metadata(), metadata));
        }
        return builder.build();
    }

    static void requireMutable(Task task, TaskState requested) {
        if (task.state().isFinal()) {
            throw new InvalidStateTransitionException(task.id(), task.state(), requested);
        }
    }

    /**
     * Shallow merge: top-level keys replace stored values, a {@code null} value removes the key.
     */
    static Map<String, Object> mergeMetadata(Map<String, Object> existing, Map<String, Object> updates) {
        Map<String, Object> merged = new LinkedHashMap<>(existing);
        updates.forEach((key, value) -> {
            if (value == null) {
                merged.remove(key);
            } else {
                merged.put(key, value);
            }
        });
        return merged;
    }

    static Context replaceContext(Context existing, UUID contextId, Context replacement, OffsetDateTime now) {
        OffsetDateTime createdAt = existing != null ? existing.createdAt() : now;
        return new Context(contextId, replacement.contextData(), replacement.messageHistory(), createdAt, now);
    }

    static Context emptyContext(UUID contextId, OffsetDateTime now) {
        return new Context(contextId, Map.of(), List.of(), now, now);
    }

    static Task truncate(Task task, Integer historyLength) {
        PayloadValidator.validateLength(historyLength, "history_length");
        return task.withHistoryLength(historyLength);
    }

    static <T> List<T> limit(List<T> items, Integer length) {
        if (length == null || length >= items.size()) {
            return items;
        }
        return items.subList(0, length);
    }

    static void requireStates(Set<TaskState> states) {
        if (states == null || states.isEmpty()) {
            throw new ValidationException("At least one state is required");
        }
    }

    static void requireId(UUID id, String name) {
        if (id == null) {
            throw new ValidationException(name + " is required");
        }
    }

    private static List<Message> stamp(List<Message> messages, Task task, OffsetDateTime now) {
        return messages.stream()
                .map(message -> message.addressedTo(task.id(), task.contextId(), now))
                .toList();
    }

    private static <T> List<T> append(List<T> existing, List<T> additions) {
        List<T> combined = new ArrayList<>(existing.size() + additions.size());
        combined.addAll(existing);
        combined.addAll(additions);
        return combined;
    }
}
