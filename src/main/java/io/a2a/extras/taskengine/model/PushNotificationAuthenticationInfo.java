package io.a2a.extras.taskengine.model;

import java.util.List;

/**
 * Credentials the engine presents to a subscriber, e.g. schemes {@code ["Bearer"]}.
 */
public record PushNotificationAuthenticationInfo(List<String> schemes, String credentials) {

    public PushNotificationAuthenticationInfo {
        schemes = schemes == null ? List.of() : List.copyOf(schemes);
    }
}
