package io.a2a.extras.taskengine.push;

import io.a2a.extras.taskengine.model.Artifact;
import io.a2a.extras.taskengine.model.PushNotificationConfig;
import io.a2a.extras.taskengine.model.Task;
import io.a2a.extras.taskengine.model.TaskPushNotificationConfig;
import io.a2a.extras.taskengine.storage.Storage;
import io.a2a.extras.taskengine.storage.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the per-task subscriber registry and turns task transitions into lifecycle events.
 * <p>
 * Events are built on the caller's thread, so their sequence numbers follow the order of the
 * transitions, and delivered on {@code executor}. Nothing in here ever throws back into the
 * transition that triggered it: failures are logged.
 */
@Slf4j
public class PushNotificationManager {

    private final Map<UUID, PushNotificationConfig> registry = new ConcurrentHashMap<>();
    private final Map<UUID, AtomicLong> sequences = new ConcurrentHashMap<>();
    private final Storage storage;
    private final PushNotificationSender sender;
    private final Executor executor;
    private final PushNotificationConfig globalWebhook;
    private final boolean enabled;
    private final Clock clock;

    public PushNotificationManager(Storage storage,
                                   PushNotificationSender sender,
                                   Executor executor,
                                   PushNotificationConfig globalWebhook,
                                   boolean enabled,
                                   Clock clock) {
        this.storage = storage;
        this.sender = sender;
        this.executor = executor;
        this.globalWebhook = globalWebhook;
        this.enabled = enabled;
        this.clock = clock;
    }

    /**
     * Loads the persisted subscriptions into the registry.
     */
    public void initialize() {
        Map<UUID, PushNotificationConfig> persisted = storage.loadAllWebhookConfigs();
        registry.putAll(persisted);
        log.info("Loaded {} persisted push notification configs", persisted.size());
    }

    /**
     * Registers the subscriber of a task, replacing any previous one.
     *
     * @param persist also write the config to storage so it survives a restart
     */
    public PushNotificationConfig register(UUID taskId, PushNotificationConfig config, boolean persist) {
        if (taskId == null) {
            throw new ValidationException("task_id is required");
        }
        PushNotificationConfig normalized = normalize(config);
        if (persist) {
            storage.saveWebhookConfig(taskId, normalized);
        }
        registry.put(taskId, normalized);
        log.debug("Registered push notification config for task {}", taskId);
        return normalized;
    }

    public Optional<PushNotificationConfig> get(UUID taskId) {
        return Optional.ofNullable(registry.get(taskId));
    }

    /**
     * @param taskId restricts the result to one task when non-null
     */
    public List<TaskPushNotificationConfig> list(UUID taskId) {
        List<TaskPushNotificationConfig> configs = new ArrayList<>();
        registry.forEach((id, config) -> {
            if (taskId == null || taskId.equals(id)) {
                configs.add(new TaskPushNotificationConfig(id, config));
            }
        });
        return configs;
    }

    public boolean delete(UUID taskId) {
        storage.deleteWebhookConfig(taskId);
        boolean removed = registry.remove(taskId) != null;
        if (removed) {
            log.debug("Removed push notification config for task {}", taskId);
        }
        return removed;
    }

    /**
     * Drops registry entries and sequence counters of deleted tasks. Storage rows are removed by the
     * storage operation that deleted the tasks.
     */
    public void forgetTasks(Collection<UUID> taskIds) {
        taskIds.forEach(taskId -> {
            registry.remove(taskId);
            sequences.remove(taskId);
        });
    }

    public void forgetAll() {
        registry.clear();
        sequences.clear();
    }

    /**
     * Emits a status-update event for the task's current status, followed by one artifact-update
     * event per new artifact.
     */
    public void onTransition(Task task, List<Artifact> newArtifacts) {
        if (!enabled) {
            return;
        }
        try {
            PushNotificationConfig target = resolveTarget(task.id());
            List<LifecycleEvent> events = new ArrayList<>();
            events.add(new StatusUpdateEvent(UUID.randomUUID(), nextSequence(task.id()), now(),
                    task.id(), task.contextId(), task.status(), task.state().isFinal()));
            if (newArtifacts != null) {
                for (Artifact artifact : newArtifacts) {
                    events.add(new ArtifactUpdateEvent(UUID.randomUUID(), nextSequence(task.id()), now(),
                            task.id(), task.contextId(), artifact));
                }
            }
            if (task.state().isFinal()) {
                // no further transitions once final
                sequences.remove(task.id());
            }
            if (target != null) {
                events.forEach(event -> dispatch(target, event));
            }
        } catch (RuntimeException e) {
            log.error("Failed to build lifecycle events for task {}", task.id(), e);
        }
    }

    private void dispatch(PushNotificationConfig target, LifecycleEvent event) {
        try {
            executor.execute(() -> deliver(target, event));
        } catch (RejectedExecutionException e) {
            log.warn("Dropped {} event {} for task {}: dispatcher rejected it", event.kind(), event.sequence(),
                    event.taskId());
        }
    }

    private void deliver(PushNotificationConfig target, LifecycleEvent event) {
        try {
            sender.send(target, event);
            log.debug("Delivered {} event {} for task {}", event.kind(), event.sequence(), event.taskId());
        } catch (NotificationDeliveryException e) {
            log.warn("Failed to deliver {} event {} for task {} (status {}): {}", event.kind(), event.sequence(),
                    event.taskId(), e.getStatusCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Failed to deliver {} event {} for task {}: {}", event.kind(), event.sequence(),
                    event.taskId(), e.getMessage());
        }
    }

    private PushNotificationConfig resolveTarget(UUID taskId) {
        PushNotificationConfig own = registry.get(taskId);
        return own != null ? own : globalWebhook;
    }

    int trackedSequenceCount() {
        return sequences.size();
    }

    private long nextSequence(UUID taskId) {
        return sequences.computeIfAbsent(taskId, id -> new AtomicLong()).incrementAndGet();
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
    }

    /**
     * Validates the subscriber url and assigns an id when the config has none.
     */
    public static PushNotificationConfig normalize(PushNotificationConfig config) {
        if (config == null || config.url() == null || config.url().isBlank()) {
            throw new ValidationException("Push notification config requires a url");
        }
        URI uri;
        try {
            uri = URI.create(config.url());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid push notification url: " + config.url());
        }
        boolean httpScheme = "http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme());
        if (!httpScheme || uri.getHost() == null) {
            throw new ValidationException("Push notification url must be an absolute http(s) url");
        }
        if (config.id() != null) {
            return config;
        }
        return new PushNotificationConfig(UUID.randomUUID(), config.url(), config.token(), config.authentication());
    }
}
