package io.a2a.extras.taskengine.storage;

import io.a2a.extras.taskengine.model.Artifact;
import io.a2a.extras.taskengine.model.DataPart;
import io.a2a.extras.taskengine.model.FilePart;
import io.a2a.extras.taskengine.model.Message;
import io.a2a.extras.taskengine.model.Part;
import io.a2a.extras.taskengine.model.TaskFeedback;
import io.a2a.extras.taskengine.model.TextPart;

import java.util.List;
import java.util.Map;

/**
 * Structural checks applied to every payload before it is written.
 */
public final class PayloadValidator {

    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 5;

    private PayloadValidator() {
    }

    public static void validateMessage(Message message) {
        if (message == null) {
            throw new ValidationException("Message cannot be null");
        }
        if (message.role() == null) {
            throw new ValidationException("Message role is required");
        }
        validateParts(message.parts(), "Message");
    }

    public static void validateMessages(List<Message> messages) {
        if (messages != null) {
            messages.forEach(PayloadValidator::validateMessage);
        }
    }

    public static void validateArtifacts(List<Artifact> artifacts) {
        if (artifacts == null) {
            return;
        }
        for (Artifact artifact : artifacts) {
            if (artifact == null) {
                throw new ValidationException("Artifact cannot be null");
            }
            if (artifact.artifactId() == null) {
                throw new ValidationException("Artifact id is required");
            }
            validateParts(artifact.parts(), "Artifact");
        }
    }

    /**
     * Feedback needs an integer rating between 1 and 5; a comment, when present, must be a string.
     */
    public static void validateFeedback(Map<String, Object> feedbackData) {
        if (feedbackData == null) {
            throw new ValidationException("Feedback cannot be null");
        }
        Object rating = feedbackData.get(TaskFeedback.RATING);
        if (!(rating instanceof Integer || rating instanceof Long || rating instanceof Short)) {
            throw new ValidationException("Feedback rating must be an integer");
        }
        long value = ((Number) rating).longValue();
        if (value < MIN_RATING || value > MAX_RATING) {
            throw new ValidationException("Feedback rating must be between " + MIN_RATING + " and " + MAX_RATING);
        }
        Object comment = feedbackData.get(TaskFeedback.COMMENT);
        if (comment != null && !(comment instanceof String)) {
            throw new ValidationException("Feedback comment must be a string");
        }
    }

    public static void validateLength(Integer length, String name) {
        if (length != null && length < 0) {
            throw new ValidationException(name + " must not be negative");
        }
    }

    private static void validateParts(List<Part> parts, String owner) {
        if (parts.isEmpty()) {
            throw new ValidationException(owner + " must contain at least one part");
        }
        for (Part part : parts) {
            if (part == null) {
                throw new ValidationException(owner + " contains a null part");
            }
            if (part instanceof TextPart text && text.text() == null) {
                throw new ValidationException("Text part requires text");
            }
            if (part instanceof DataPart data && data.data() == null) {
                throw new ValidationException("Data part requires data");
            }
            if (part instanceof FilePart file && (file.uri() == null) == (file.bytes() == null)) {
                throw new ValidationException("File part requires exactly one of uri or bytes");
            }
        }
    }
}
