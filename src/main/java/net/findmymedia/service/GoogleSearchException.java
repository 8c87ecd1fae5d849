package net.findmymedia.service;

/**
 * Thrown when the web search API cannot be reached or answers with a non-2xx status
 * or an unreadable body.
 */
public class GoogleSearchException extends RuntimeException {

    private final int statusCode;

    public GoogleSearchException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public GoogleSearchException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the failed call, or -1 for transport and parse failures.
     */
    public int statusCode() {
        return statusCode;
    }
}
