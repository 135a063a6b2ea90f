package io.a2a.extras.taskengine.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PushNotificationConfig(UUID id, String url, String token, PushNotificationAuthenticationInfo authentication) {

    public static PushNotificationConfig of(String url, String token) {
        return new PushNotificationConfig(UUID.randomUUID(), url, token, null);
    }
}
