package io.a2a.extras.taskengine.push;

import io.a2a.extras.taskengine.jdbc.JsonUtils;
import io.a2a.extras.taskengine.model.PushNotificationAuthenticationInfo;
import io.a2a.extras.taskengine.model.PushNotificationConfig;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Posts events as JSON. A {@code token} is sent as a bearer credential; otherwise the first
 * scheme of {@code authentication} is used with its credentials.
 */
public class HttpPushNotificationSender implements PushNotificationSender {

    private final RestClient restClient;

    public HttpPushNotificationSender(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public void send(PushNotificationConfig config, LifecycleEvent event) {
        String body = JsonUtils.toJson(event);
        ResponseEntity<Void> response;
        try {
            response = restClient.post()
                    .uri(config.url())
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> applyAuthentication(headers, config))
                    .body(body)
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientResponseException e) {
            throw new NotificationDeliveryException(
                    "Subscriber answered " + e.getStatusCode().value(), e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new NotificationDeliveryException("Subscriber unreachable: " + e.getMessage(), null, e);
        } catch (RestClientException e) {
            throw new NotificationDeliveryException("Delivery failed: " + e.getMessage(), null, e);
        }
        // redirects are not followed, so a 3xx means the event was not accepted
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new NotificationDeliveryException(
                    "Subscriber answered " + response.getStatusCode().value(), response.getStatusCode().value(), null);
        }
    }

    static void applyAuthentication(HttpHeaders headers, PushNotificationConfig config) {
        if (config.token() != null && !config.token().isBlank()) {
            headers.setBearerAuth(config.token());
            return;
        }
        PushNotificationAuthenticationInfo authentication = config.authentication();
        if (authentication != null && !authentication.schemes().isEmpty() && authentication.credentials() != null) {
            headers.set(HttpHeaders.AUTHORIZATION, authentication.schemes().get(0) + " " + authentication.credentials());
        }
    }
}
