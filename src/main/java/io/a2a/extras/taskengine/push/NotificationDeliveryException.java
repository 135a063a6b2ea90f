package io.a2a.extras.taskengine.push;

/**
 * A subscriber could not be reached or answered with a non-2xx status. Only ever logged.
 */
public class NotificationDeliveryException extends RuntimeException {

    private final Integer statusCode;

    public NotificationDeliveryException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return the HTTP status, or null when no response was received
     */
    public Integer getStatusCode() {
        return statusCode;
    }
}
