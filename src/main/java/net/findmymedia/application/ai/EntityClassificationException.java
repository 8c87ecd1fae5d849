package net.findmymedia.application.ai;

import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;

import java.util.Objects;

/**
 * Thrown when AI ranking of search results fails: the chat completion call errors,
 * returns nothing, or returns text that is not the expected JSON object.
 */
public class EntityClassificationException extends RuntimeException {

    /**
     * Failure categories emitted by the classifier.
     */
    public enum ErrorCode {
        NOT_CONFIGURED,
        API_CALL_FAILED,
        EMPTY_RESPONSE,
        INVALID_RESPONSE
    }

    private final ErrorCode errorCode;

    public EntityClassificationException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public EntityClassificationException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    /**
     * Formats an OpenAI SDK exception as HTTP status plus a short explanation when available.
     */
    public static String describeApiError(OpenAIException ex) {
        if (ex instanceof OpenAIServiceException serviceException) {
            int status = serviceException.statusCode();
            String explanation = switch (status) {
                case 400 -> "bad request";
                case 401 -> "unauthorized, check API key";
                case 403 -> "access denied";
                case 404 -> "not found, check base URL and model name";
                case 429 -> "rate limited";
                case 500, 502, 503 -> "server error";
                default -> "unexpected status";
            };
            return "HTTP %d %s".formatted(status, explanation);
        }
        if (ex instanceof OpenAIIoException) {
            return "network error: " + ex.getMessage();
        }
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}
