package com.taskchat.reasoning;

/**
 * The reasoning engine could not produce an answer for this call.
 */
public class ReasoningException extends Exception {

    public ReasoningException(String message) {
        super(message);
    }

    public ReasoningException(String message, Throwable cause) {
        super(message, cause);
    }
}
