package com.taskchat.reasoning;

/**
 * Connection failure, rate limiting, a server-side error or an unreadable
 * response from the reasoning service.
 */
public class ReasoningUnavailableException extends ReasoningException {
    private final int statusCode;

    public ReasoningUnavailableException(String message) {
        this(message, 0, null);
    }

    public ReasoningUnavailableException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public ReasoningUnavailableException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return the HTTP status that caused the failure, or 0 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }
}
