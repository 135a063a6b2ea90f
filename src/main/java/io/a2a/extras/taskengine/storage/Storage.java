package io.a2a.extras.taskengine.storage;

import io.a2a.extras.taskengine.model.Artifact;
import io.a2a.extras.taskengine.model.Context;
import io.a2a.extras.taskengine.model.Message;
import io.a2a.extras.taskengine.model.PushNotificationConfig;
import io.a2a.extras.taskengine.model.Task;
import io.a2a.extras.taskengine.model.TaskFeedback;
import io.a2a.extras.taskengine.model.TaskState;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Persistence contract for tasks, contexts, feedback and webhook configurations.
 * <p>
 * Exactly two implementations exist, chosen once at startup: {@link InMemoryStorage} and
 * {@link JdbcStorage}. Both honour the same semantics:
 * <ul>
 *     <li>a task in a final state is immutable, every mutation fails with
 *     {@link InvalidStateTransitionException};</li>
 *     <li>concurrent updates of the same task never lose appended messages or artifacts;</li>
 *     <li>lists are ordered most recent first, {@code length} caps their size.</li>
 * </ul>
 * Payloads are validated before anything is written ({@link ValidationException}).
 */
public sealed interface Storage extends AutoCloseable permits InMemoryStorage, JdbcStorage {

    /**
     * Loads a task.
     *
     * @param taskId        the task id
     * @param historyLength when non-null, only the most recent messages are returned; stored state is untouched
     * @return the task, or empty when unknown
     */
    Optional<Task> loadTask(UUID taskId, Integer historyLength);

    default Optional<Task> loadTask(UUID taskId) {
        return loadTask(taskId, null);
    }

    /**
     * Records an inbound message. When the message names an existing non-final task the message is
     * appended to it; otherwise a new task in state {@code submitted} is created with the message as
     * its only history entry, creating the context if needed.
     */
    Task submitTask(UUID contextId, Message message);

    /**
     * Moves the task to {@code state} (or keeps the current one when {@code null}), appends the
     * given artifacts and messages and merges metadata key by key. A {@code null} metadata value
     * removes the key.
     * <p>
     * {@code rule} is evaluated against the stored state while the task is locked; a rejected edge
     * fails with {@link InvalidStateTransitionException} and nothing is written.
     */
    Task updateTask(UUID taskId, TaskState state, List<Artifact> newArtifacts, List<Message> newMessages,
                    Map<String, Object> metadata, TransitionRule rule);

    default Task updateTask(UUID taskId, TaskState state, List<Artifact> newArtifacts, List<Message> newMessages,
                            Map<String, Object> metadata) {
        return updateTask(taskId, state, newArtifacts, newMessages, metadata, TransitionRule.ANY);
    }

    default Task updateTask(UUID taskId, TaskState state) {
        return updateTask(taskId, state, null, null, null);
    }

    List<Task> listTasks(Integer length);

    List<Task> listTasksByContext(UUID contextId, Integer length);

    /**
     * Tasks of the context whose state is one of {@code states}, most recent first.
     */
    List<Task> listTasksByContextAndState(UUID contextId, Set<TaskState> states, Integer length);

    Optional<Context> loadContext(UUID contextId);

    /**
     * Creates or replaces the context data and message history; creation time is kept on replace.
     */
    Context updateContext(UUID contextId, Context context);

    /**
     * Appends messages to the context history, creating the context when absent.
     */
    Context appendToContext(UUID contextId, List<Message> messages);

    List<Context> listContexts(Integer length);

    /**
     * Removes the context with its tasks, their feedback and webhook configurations.
     * Does nothing when the context does not exist.
     */
    void clearContext(UUID contextId);

    void clearAll();

    void storeTaskFeedback(UUID taskId, Map<String, Object> feedbackData);

    /**
     * @return feedback for the task, oldest first
     */
    List<TaskFeedback> getTaskFeedback(UUID taskId);

    void saveWebhookConfig(UUID taskId, PushNotificationConfig config);

    Optional<PushNotificationConfig> loadWebhookConfig(UUID taskId);

    void deleteWebhookConfig(UUID taskId);

    Map<UUID, PushNotificationConfig> loadAllWebhookConfigs();

    @Override
    default void close() {
    }
}
