package com.taskchat.chat;

/**
 * A turn could not be completed. The detail is safe to show to the caller:
 * it never carries store internals or another owner's data.
 */
public class TurnFailedException extends RuntimeException {
    private final ErrorKind kind;

    public TurnFailedException(ErrorKind kind, String detail) {
        super(detail);
        this.kind = kind;
    }

    public TurnFailedException(ErrorKind kind, String detail, Throwable cause) {
        super(detail, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getDetail() {
        return getMessage();
    }
}
