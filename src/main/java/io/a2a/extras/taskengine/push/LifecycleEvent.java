package io.a2a.extras.taskengine.push;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Payload posted to a subscriber. Events of one task share a sequence that starts at 1.
 */
public sealed interface LifecycleEvent permits StatusUpdateEvent, ArtifactUpdateEvent {

    UUID eventId();

    long sequence();

    OffsetDateTime timestamp();

    String kind();

    UUID taskId();

    UUID contextId();
}
