package io.a2a.extras.taskengine.push;

import io.a2a.extras.taskengine.model.PushNotificationConfig;

@FunctionalInterface
public interface PushNotificationSender {

    /**
     * Delivers one event, blocking until the subscriber answered or the delivery timed out.
     *
     * @throws NotificationDeliveryException when delivery failed
     */
    void send(PushNotificationConfig config, LifecycleEvent event);
}
