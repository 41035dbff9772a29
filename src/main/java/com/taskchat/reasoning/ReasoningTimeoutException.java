package com.taskchat.reasoning;

public class ReasoningTimeoutException extends ReasoningException {

    public ReasoningTimeoutException(String message) {
        super(message);
    }

    public ReasoningTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
