package io.a2a.extras.taskengine.storage;

import io.a2a.extras.taskengine.lifecycle.TaskStateMachine;
import io.a2a.extras.taskengine.model.Artifact;
import io.a2a.extras.taskengine.model.Context;
import io.a2a.extras.taskengine.model.Message;
import io.a2a.extras.taskengine.model.PushNotificationConfig;
import io.a2a.extras.taskengine.model.Role;
import io.a2a.extras.taskengine.model.Task;
import io.a2a.extras.taskengine.model.TaskFeedback;
import io.a2a.extras.taskengine.model.TaskState;
import io.a2a.extras.taskengine.model.TextPart;
import io.a2a.extras.taskengine.support.TickingClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static io.a2a.extras.taskengine.support.MessageTestBuilder.aMessage;
import static io.a2a.extras.taskengine.support.MessageTestBuilder.aUserMessage;
import static io.a2a.extras.taskengine.support.MessageTestBuilder.anAgentMessage;
import static io.a2a.extras.taskengine.support.MessageTestBuilder.anArtifact;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Behaviour every {@link Storage} backend must share.
 */
abstract class AbstractStorageContractTest {

    protected Storage storage;
    protected TickingClock clock;

    protected abstract Storage createStorage(TickingClock clock);

    @BeforeEach
    void setUpStorage() {
        clock = TickingClock.aTickingClock();
        storage = createStorage(clock);
    }

    @AfterEach
    void closeStorage() {
        storage.close();
    }

    @Test
    void shouldCreateSubmittedTaskWithMessageAsHistory() {
        UUID contextId = UUID.randomUUID();
        Message message = aUserMessage("hi");

        Task submitted = storage.submitTask(contextId, message);
        Task loaded = storage.loadTask(submitted.id()).orElseThrow();

        assertThat(loaded.state()).isEqualTo(TaskState.SUBMITTED);
        assertThat(loaded.contextId()).isEqualTo(contextId);
        assertThat(loaded.kind()).isEqualTo(Task.KIND);
        assertThat(loaded.history()).hasSize(1);
        Message stored = loaded.history().get(0);
        assertThat(stored.messageId()).isEqualTo(message.messageId());
        assertThat(stored.parts()).containsExactly(new TextPart("hi"));
        assertThat(stored.taskId()).isEqualTo(submitted.id());
        assertThat(stored.contextId()).isEqualTo(contextId);
        assertThat(loaded.artifacts()).isEmpty();
        assertThat(loaded.createdAt()).isNotNull();
    }

    @Test
    void shouldUseTaskIdCarriedByMessage() {
        UUID taskId = UUID.randomUUID();

        Task submitted = storage.submitTask(UUID.randomUUID(), aMessage().withTaskId(taskId).withText("hi").build());

        assertThat(submitted.id()).isEqualTo(taskId);
    }

    @Test
    void shouldCreateContextImplicitlyOnFirstSubmission() {
        UUID contextId = UUID.randomUUID();

        storage.submitTask(contextId, aUserMessage("hi"));

        assertThat(storage.loadContext(contextId)).isPresent();
    }

    @Test
    void shouldAppendToNonTerminalTaskNamedByMessage() {
        UUID contextId = UUID.randomUUID();
        Task task = storage.submitTask(contextId, aUserMessage("first"));

        Task continued = storage.submitTask(contextId, aMessage().withTaskId(task.id()).withText("second").build());

        assertThat(continued.id()).isEqualTo(task.id());
        assertThat(continued.state()).isEqualTo(TaskState.SUBMITTED);
        assertThat(continued.history()).extracting(m -> m.parts().get(0))
                .containsExactly(new TextPart("first"), new TextPart("second"));
        assertThat(storage.listTasksByContext(contextId, null)).hasSize(1);
    }

    @Test
    void shouldRejectSubmissionToTerminalTask() {
        UUID contextId = UUID.randomUUID();
        Task task = storage.submitTask(contextId, aUserMessage("hi"));
        storage.updateTask(task.id(), TaskState.COMPLETED);

        assertThatThrownBy(() -> storage.submitTask(contextId, aMessage().withTaskId(task.id()).withText("again").build()))
                .isInstanceOf(InvalidStateTransitionException.class);
        assertThat(storage.loadTask(task.id()).orElseThrow().history()).hasSize(1);
    }

    @Test
    void shouldRejectSubmissionToTaskOfAnotherContext() {
        Task task = storage.submitTask(UUID.randomUUID(), aUserMessage("hi"));

        assertThatThrownBy(() -> storage.submitTask(UUID.randomUUID(),
                aMessage().withTaskId(task.id()).withText("elsewhere").build()))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldRejectMalformedMessageBeforeWriting() {
        UUID contextId = UUID.randomUUID();
        Message withoutParts = aMessage().build();
        Message withoutRole = new Message.Builder().parts(new TextPart("x")).build();

        assertThatThrownBy(() -> storage.submitTask(contextId, withoutParts)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> storage.submitTask(contextId, withoutRole)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> storage.submitTask(contextId, null)).isInstanceOf(ValidationException.class);
        assertThat(storage.loadContext(contextId)).isEmpty();
    }

    @Test
    void shouldReturnEmptyForUnknownTask() {
        assertThat(storage.loadTask(UUID.randomUUID())).isEmpty();
    }

    @Test
    void shouldTruncateHistoryWithoutChangingStoredTask() {
        UUID contextId = UUID.randomUUID();
        Task task = storage.submitTask(contextId, aUserMessage("one"));
        storage.updateTask(task.id(), TaskState.WORKING, null,
                List.of(anAgentMessage("two"), anAgentMessage("three")), null);

        Task truncated = storage.loadTask(task.id(), 2).orElseThrow();

        assertThat(truncated.history()).extracting(m -> m.parts().get(0))
                .containsExactly(new TextPart("two"), new TextPart("three"));
        assertThat(storage.loadTask(task.id(), 0).orElseThrow().history()).isEmpty();
        assertThat(storage.loadTask(task.id(), 10).orElseThrow().history()).hasSize(3);
        assertThat(storage.loadTask(task.id()).orElseThrow().history()).hasSize(3);
        assertThatThrownBy(() -> storage.loadTask(task.id(), -1)).isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldWalkTaskToCompletionAndFreezeIt() {
        UUID contextId = UUID.randomUUID();
        Task task = storage.submitTask(contextId, aUserMessage("hi"));

        Task working = storage.updateTask(task.id(), TaskState.WORKING);
        assertThat(working.state()).isEqualTo(TaskState.WORKING);

        Artifact hello = anArtifact("reply", "hello!");
        Task completed = storage.updateTask(task.id(), TaskState.COMPLETED, List.of(hello), null, null);
        assertThat(completed.state()).isEqualTo(TaskState.COMPLETED);
        assertThat(completed.artifacts()).containsExactly(hello);

        assertThatThrownBy(() -> storage.updateTask(task.id(), TaskState.WORKING, List.of(anArtifact("late", "x")),
                List.of(anAgentMessage("late")), Map.of("k", "v")))
                .isInstanceOf(InvalidStateTransitionException.class)
                .satisfies(e -> {
                    InvalidStateTransitionException error = (InvalidStateTransitionException) e;
                    assertThat(error.getTaskId()).isEqualTo(task.id());
                    assertThat(error.getCurrentState()).isEqualTo(TaskState.COMPLETED);
                });

        Task reloaded = storage.loadTask(task.id()).orElseThrow();
        assertThat(reloaded.state()).isEqualTo(TaskState.COMPLETED);
        assertThat(reloaded.artifacts()).containsExactly(hello);
        assertThat(reloaded.history()).hasSize(1);
        assertThat(reloaded.metadata()).isEmpty();
    }

    @Test
    void shouldStampAppendedMessagesWithTaskAndContext() {
        UUID contextId = UUID.randomUUID();
        Task task = storage.submitTask(contextId, aUserMessage("hi"));

        Task updated = storage.updateTask(task.id(), TaskState.WORKING, null, List.of(anAgentMessage("on it")), null);

        Message reply = updated.history().get(1);
        assertThat(reply.role()).isEqualTo(Role.AGENT);
        assertThat(reply.taskId()).isEqualTo(task.id());
        assertThat(reply.contextId()).isEqualTo(contextId);
        assertThat(reply.timestamp()).isNotNull();
    }

    @Test
    void shouldMergeMetadataPerTopLevelKey() {
        Task task = storage.submitTask(UUID.randomUUID(), aUserMessage("hi"));
        storage.updateTask(task.id(), null, null, null, Map.of("a", 1, "b", Map.of("x", 1)));

        Map<String, Object> update = new HashMap<>();
        update.put("b", Map.of("y", 2));
        update.put("a", null);
        update.put("c", "new");
        Task merged = storage.updateTask(task.id(), null, null, null, update);

        assertThat(merged.state()).isEqualTo(TaskState.SUBMITTED);
        assertThat(merged.metadata()).containsOnlyKeys("b", "c");
        assertThat(merged.metadata().get("b")).isEqualTo(Map.of("y", 2));
        assertThat(storage.loadTask(task.id()).orElseThrow().metadata()).isEqualTo(merged.metadata());
    }

    @Test
    void shouldFailUpdateOfUnknownTask() {
        assertThatThrownBy(() -> storage.updateTask(UUID.randomUUID(), TaskState.WORKING))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void shouldRejectMalformedArtifacts() {
        Task task = storage.submitTask(UUID.randomUUID(), aUserMessage("hi"));
        Artifact empty = new Artifact(UUID.randomUUID(), "empty", null, List.of(), null);

        assertThatThrownBy(() -> storage.updateTask(task.id(), TaskState.WORKING, List.of(empty), null, null))
                .isInstanceOf(ValidationException.class);
        assertThat(storage.loadTask(task.id()).orElseThrow().state()).isEqualTo(TaskState.SUBMITTED);
    }

    @Test
    void shouldListTasksOfContextMostRecentFirst() {
        UUID contextId = UUID.randomUUID();
        UUID otherContextId = UUID.randomUUID();
        Task first = storage.submitTask(contextId, aUserMessage("1"));
        Task other = storage.submitTask(otherContextId, aUserMessage("other"));
        Task second = storage.submitTask(contextId, aUserMessage("2"));
        Task third = storage.submitTask(contextId, aUserMessage("3"));

        assertThat(storage.listTasksByContext(contextId, null)).extracting(Task::id)
                .containsExactly(third.id(), second.id(), first.id());
        assertThat(storage.listTasksByContext(contextId, 2)).extracting(Task::id)
                .containsExactly(third.id(), second.id());
        assertThat(storage.listTasksByContext(contextId, 0)).isEmpty();
        assertThat(storage.listTasksByContext(UUID.randomUUID(), null)).isEmpty();
        assertThat(storage.listTasks(null)).extracting(Task::id)
                .containsExactly(third.id(), second.id(), other.id(), first.id());
        assertThat(storage.listTasks(1)).extracting(Task::id).containsExactly(third.id());
        assertThatThrownBy(() -> storage.listTasks(-1)).isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldListTasksOfContextInGivenStates() {
        UUID contextId = UUID.randomUUID();
        Task waiting = storage.submitTask(contextId, aUserMessage("1"));
        storage.updateTask(waiting.id(), TaskState.INPUT_REQUIRED);
        Task submitted = storage.submitTask(contextId, aUserMessage("2"));
        Task auth = storage.submitTask(contextId, aUserMessage("3"));
        storage.updateTask(auth.id(), TaskState.AUTH_REQUIRED);
        storage.submitTask(UUID.randomUUID(), aUserMessage("elsewhere"));
        Set<TaskState> interrupted = EnumSet.of(TaskState.INPUT_REQUIRED, TaskState.AUTH_REQUIRED);

        assertThat(storage.listTasksByContextAndState(contextId, interrupted, null)).extracting(Task::id)
                .containsExactly(auth.id(), waiting.id());
        assertThat(storage.listTasksByContextAndState(contextId, interrupted, 1)).extracting(Task::id)
                .containsExactly(auth.id());
        assertThat(storage.listTasksByContextAndState(contextId, EnumSet.of(TaskState.SUBMITTED), null))
                .extracting(Task::id).containsExactly(submitted.id());
        assertThatThrownBy(() -> storage.listTasksByContextAndState(contextId, Set.of(), null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldCheckTransitionRuleAgainstStoredState() {
        // Given
        Task task = storage.submitTask(UUID.randomUUID(), aUserMessage("hi"));
        storage.updateTask(task.id(), TaskState.WORKING);
        storage.updateTask(task.id(), TaskState.INPUT_REQUIRED);
        List<TaskState> seen = new ArrayList<>();
        TransitionRule onlyFromWorking = (from, to) -> {
            seen.add(from);
            return from == TaskState.WORKING;
        };

        // When / Then
        assertThatThrownBy(() -> storage.updateTask(task.id(), TaskState.COMPLETED,
                List.of(anArtifact("late", "content")), List.of(anAgentMessage("done")), Map.of("k", "v"),
                onlyFromWorking))
                .isInstanceOf(InvalidStateTransitionException.class)
                .hasMessageContaining("input-required");

        assertThat(seen).containsExactly(TaskState.INPUT_REQUIRED);
        Task stored = storage.loadTask(task.id()).orElseThrow();
        assertThat(stored.state()).isEqualTo(TaskState.INPUT_REQUIRED);
        assertThat(stored.history()).hasSize(1);
        assertThat(stored.artifacts()).isEmpty();
        assertThat(stored.metadata()).isEmpty();
    }

    @Test
    void shouldLetExactlyOneOfTwoConflictingTransitionsWin() throws Exception {
        for (int round = 0; round < 20; round++) {
            Task task = storage.submitTask(UUID.randomUUID(), aUserMessage("round " + round));
            storage.updateTask(task.id(), TaskState.WORKING);
            ExecutorService pool = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<TaskState>> outcomes = new ArrayList<>();

            try {
                for (TaskState target : List.of(TaskState.INPUT_REQUIRED, TaskState.COMPLETED)) {
                    outcomes.add(pool.submit(() -> {
                        start.await();
                        try {
                            return storage.updateTask(task.id(), target, null, null, null,
                                    TaskStateMachine::canTransition).state();
                        } catch (InvalidStateTransitionException e) {
                            return null;
                        }
                    }));
                }
                start.countDown();
                List<TaskState> applied = new ArrayList<>();
                for (Future<TaskState> outcome : outcomes) {
                    TaskState state = outcome.get(30, TimeUnit.SECONDS);
                    if (state != null) {
                        applied.add(state);
                    }
                }

                // input-required -> completed is not an edge, so the loser must fail
                assertThat(applied).hasSize(1);
                assertThat(storage.loadTask(task.id()).orElseThrow().state()).isEqualTo(applied.get(0));
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Test
    void shouldUpsertContextKeepingCreationTime() {
        UUID contextId = UUID.randomUUID();

        Context created = storage.updateContext(contextId, Context.of(contextId, Map.of("topic", "weather")));
        Context replaced = storage.updateContext(contextId, Context.of(contextId, Map.of("topic", "news")));

        assertThat(replaced.contextData()).isEqualTo(Map.of("topic", "news"));
        assertThat(replaced.createdAt()).isEqualTo(created.createdAt());
        assertThat(replaced.updatedAt()).isAfter(created.updatedAt());
        assertThat(storage.loadContext(contextId).orElseThrow().contextData()).isEqualTo(Map.of("topic", "news"));
    }

    @Test
    void shouldAppendToContextHistory() {
        UUID contextId = UUID.randomUUID();

        storage.appendToContext(contextId, List.of(aUserMessage("hi")));
        Context context = storage.appendToContext(contextId, List.of(anAgentMessage("hello")));

        assertThat(context.messageHistory()).extracting(Message::role).containsExactly(Role.USER, Role.AGENT);
        assertThat(context.messageHistory()).allSatisfy(m -> assertThat(m.contextId()).isEqualTo(contextId));
        assertThat(storage.loadContext(contextId).orElseThrow().messageHistory()).hasSize(2);
    }

    @Test
    void shouldListContextsMostRecentFirst() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        storage.updateContext(first, Context.of(first, Map.of()));
        storage.submitTask(second, aUserMessage("hi"));

        assertThat(storage.listContexts(null)).extracting(Context::id).containsExactly(second, first);
        assertThat(storage.listContexts(1)).extracting(Context::id).containsExactly(second);
    }

    @Test
    void shouldClearContextWithItsTasksFeedbackAndWebhookConfigs() {
        UUID contextId = UUID.randomUUID();
        UUID keptContextId = UUID.randomUUID();
        Task task = storage.submitTask(contextId, aUserMessage("hi"));
        Task kept = storage.submitTask(keptContextId, aUserMessage("keep"));
        storage.storeTaskFeedback(task.id(), Map.of(TaskFeedback.RATING, 5));
        storage.saveWebhookConfig(task.id(), PushNotificationConfig.of("https://hooks.example.com/a2a", "t"));
        storage.saveWebhookConfig(kept.id(), PushNotificationConfig.of("https://hooks.example.com/keep", null));

        storage.clearContext(contextId);

        assertThat(storage.loadContext(contextId)).isEmpty();
        assertThat(storage.loadTask(task.id())).isEmpty();
        assertThat(storage.listTasksByContext(contextId, null)).isEmpty();
        assertThat(storage.getTaskFeedback(task.id())).isEmpty();
        assertThat(storage.loadWebhookConfig(task.id())).isEmpty();
        assertThat(storage.loadTask(kept.id())).isPresent();
        assertThat(storage.loadWebhookConfig(kept.id())).isPresent();
    }

    @Test
    void shouldClearContextIdempotently() {
        UUID contextId = UUID.randomUUID();
        storage.submitTask(contextId, aUserMessage("hi"));

        storage.clearContext(contextId);
        storage.clearContext(contextId);
        storage.clearContext(UUID.randomUUID());

        assertThat(storage.loadContext(contextId)).isEmpty();
        assertThat(storage.listTasksByContext(contextId, null)).isEmpty();
    }

    @Test
    void shouldClearEverything() {
        Task task = storage.submitTask(UUID.randomUUID(), aUserMessage("a"));
        storage.submitTask(UUID.randomUUID(), aUserMessage("b"));
        storage.saveWebhookConfig(task.id(), PushNotificationConfig.of("https://hooks.example.com/a2a", null));

        storage.clearAll();

        assertThat(storage.listTasks(null)).isEmpty();
        assertThat(storage.listContexts(null)).isEmpty();
        assertThat(storage.loadAllWebhookConfigs()).isEmpty();
    }

    @Test
    void shouldStoreFeedbackOldestFirst() {
        Task task = storage.submitTask(UUID.randomUUID(), aUserMessage("hi"));

        storage.storeTaskFeedback(task.id(), Map.of(TaskFeedback.RATING, 5));
        storage.storeTaskFeedback(task.id(), Map.of(TaskFeedback.RATING, 2, TaskFeedback.COMMENT, "slow"));

        List<TaskFeedback> feedback = storage.getTaskFeedback(task.id());
        assertThat(feedback).hasSize(2);
        assertThat(feedback.get(0).rating()).isEqualTo(5);
        assertThat(feedback.get(0).taskId()).isEqualTo(task.id());
        assertThat(feedback.get(1).rating()).isEqualTo(2);
        assertThat(feedback.get(1).comment()).isEqualTo("slow");
        assertThat(storage.getTaskFeedback(UUID.randomUUID())).isEmpty();
    }

    @Test
    void shouldRejectInvalidFeedback() {
        Task task = storage.submitTask(UUID.randomUUID(), aUserMessage("hi"));

        assertThatThrownBy(() -> storage.storeTaskFeedback(task.id(), Map.of(TaskFeedback.COMMENT, "no rating")))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> storage.storeTaskFeedback(task.id(), Map.of(TaskFeedback.RATING, 6)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> storage.storeTaskFeedback(task.id(), Map.of(TaskFeedback.RATING, "5")))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> storage.storeTaskFeedback(UUID.randomUUID(), Map.of(TaskFeedback.RATING, 3)))
                .isInstanceOf(NotFoundException.class);
        assertThat(storage.getTaskFeedback(task.id())).isEmpty();
    }

    @Test
    void shouldSaveReplaceAndDeleteWebhookConfigs() {
        UUID taskId = UUID.randomUUID();
        UUID otherTaskId = UUID.randomUUID();
        PushNotificationConfig first = PushNotificationConfig.of("https://hooks.example.com/one", "token-1");
        PushNotificationConfig second = PushNotificationConfig.of("https://hooks.example.com/two", "token-2");
        PushNotificationConfig other = PushNotificationConfig.of("https://hooks.example.com/other", null);

        storage.saveWebhookConfig(taskId, first);
        storage.saveWebhookConfig(taskId, second);
        storage.saveWebhookConfig(otherTaskId, other);

        assertThat(storage.loadWebhookConfig(taskId)).contains(second);
        assertThat(storage.loadAllWebhookConfigs()).containsOnlyKeys(taskId, otherTaskId);

        storage.deleteWebhookConfig(taskId);
        storage.deleteWebhookConfig(taskId);

        assertThat(storage.loadWebhookConfig(taskId)).isEmpty();
        assertThat(storage.loadAllWebhookConfigs()).containsExactlyEntriesOf(Map.of(otherTaskId, other));
    }

    @Test
    void shouldKeepEveryConcurrentAppend() throws Exception {
        Task task = storage.submitTask(UUID.randomUUID(), aUserMessage("hi"));
        storage.updateTask(task.id(), TaskState.WORKING);
        int writers = 8;
        int updatesPerWriter = 5;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int writer = 0; writer < writers; writer++) {
                int id = writer;
                Callable<Void> work = () -> {
                    start.await();
                    for (int i = 0; i < updatesPerWriter; i++) {
                        if (id % 2 == 0) {
                            storage.updateTask(task.id(), TaskState.WORKING, null,
                                    List.of(anAgentMessage("m-" + id + "-" + i)), null);
                        } else {
                            storage.updateTask(task.id(), TaskState.WORKING,
                                    List.of(anArtifact("a-" + id + "-" + i, "content")), null, null);
                        }
                    }
                    return null;
                };
                futures.add(pool.submit(work));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        Task result = storage.loadTask(task.id()).orElseThrow();
        assertThat(result.history()).hasSize(1 + (writers / 2) * updatesPerWriter);
        assertThat(result.artifacts()).hasSize((writers / 2) * updatesPerWriter);
    }

    @Test
    void shouldKeepBothMessageAndArtifactFromTwoConcurrentUpdates() throws Exception {
        Task task = storage.submitTask(UUID.randomUUID(), aUserMessage("hi"));
        Message m1 = anAgentMessage("m1");
        Artifact a1 = anArtifact("a1", "content");
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);

        try {
            Future<Task> withMessage = pool.submit(() -> {
                start.await();
                return storage.updateTask(task.id(), TaskState.WORKING, null, List.of(m1), null);
            });
            Future<Task> withArtifact = pool.submit(() -> {
                start.await();
                return storage.updateTask(task.id(), TaskState.WORKING, List.of(a1), null, null);
            });
            start.countDown();
            withMessage.get(30, TimeUnit.SECONDS);
            withArtifact.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        Task result = storage.loadTask(task.id()).orElseThrow();
        assertThat(result.history()).extracting(Message::messageId).contains(m1.messageId());
        assertThat(result.artifacts()).containsExactly(a1);
    }

    @Test
    void shouldNotInterleaveClearContextWithInFlightUpdates() throws Exception {
        // Given
        UUID contextId = UUID.randomUUID();
        Task task = storage.submitTask(contextId, aUserMessage("hi"));
        storage.updateTask(task.id(), TaskState.WORKING);
        storage.storeTaskFeedback(task.id(), Map.of(TaskFeedback.RATING, 4));
        int maxUpdates = 200;
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch updatesStarted = new CountDownLatch(5);
        AtomicInteger committed = new AtomicInteger();

        // When
        try {
            Future<Boolean> updater = pool.submit(() -> {
                for (int i = 0; i < maxUpdates; i++) {
                    try {
                        storage.updateTask(task.id(), TaskState.WORKING, List.of(anArtifact("a-" + i, "content")),
                                List.of(anAgentMessage("m-" + i)), null);
                    } catch (NotFoundException e) {
                        return true;
                    }
                    committed.incrementAndGet();
                    updatesStarted.countDown();
                }
                return false;
            });
            Future<?> clearer = pool.submit(() -> {
                updatesStarted.await();
                storage.clearContext(contextId);
                return null;
            });
            clearer.get(60, TimeUnit.SECONDS);
            boolean sawNotFound = updater.get(60, TimeUnit.SECONDS);

            // Then
            assertThat(committed.get()).isGreaterThanOrEqualTo(5);
            if (sawNotFound) {
                assertThat(committed.get()).isLessThan(maxUpdates);
            } else {
                assertThat(committed.get()).isEqualTo(maxUpdates);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(storage.loadTask(task.id())).isEmpty();
        assertThat(storage.loadContext(contextId)).isEmpty();
        assertThat(storage.listTasksByContext(contextId, null)).isEmpty();
        assertThat(storage.getTaskFeedback(task.id())).isEmpty();
        assertThatThrownBy(() -> storage.updateTask(task.id(), TaskState.WORKING))
                .isInstanceOf(NotFoundException.class);
    }
}
