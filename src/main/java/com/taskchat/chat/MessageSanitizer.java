package com.taskchat.chat;

import java.util.regex.Pattern;

/**
 * Cleans user chat input before it is stored or sent to the reasoning engine.
 */
public final class MessageSanitizer {
    public static final int MAX_MESSAGE_LENGTH = 2000;
    public static final int MAX_TITLE_LENGTH = 80;

    // Control characters except tab, newline and carriage return.
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F-\\x9F]");
    private static final Pattern SCRIPT_BLOCK = Pattern.compile("<script[^>]*>.*?</script>",
        Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern IFRAME_BLOCK = Pattern.compile("<iframe[^>]*>.*?</iframe>",
        Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    // Only inside a tag, so plain text such as "Monday='leg day'" is kept.
    private static final Pattern EVENT_HANDLER = Pattern.compile(
        "(?<=<[^<>]{0,200}\\s)on\\w+\\s*=\\s*(\"[^\"]*\"|'[^']*')",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern SPACE_RUN = Pattern.compile(" {2,}");
    private static final Pattern TAB_RUN = Pattern.compile("\\t+");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

    private MessageSanitizer() {
    }

    /**
     * @throws TurnFailedException with {@link ErrorKind#VALIDATION_ERROR} when the
     *                             message is empty, too long, or empty once cleaned
     */
    public static String sanitize(String message) {
        if (message == null || message.trim().isEmpty()) {
            throw new TurnFailedException(ErrorKind.VALIDATION_ERROR, "Message cannot be empty");
        }
        String sanitized = message.trim();
        if (sanitized.length() > MAX_MESSAGE_LENGTH) {
            throw new TurnFailedException(ErrorKind.VALIDATION_ERROR,
                "Message exceeds max length of " + MAX_MESSAGE_LENGTH + " characters");
        }
        sanitized = sanitized.replace("\r\n", "\n");
        sanitized = CONTROL_CHARS.matcher(sanitized).replaceAll("");
        sanitized = SCRIPT_BLOCK.matcher(sanitized).replaceAll("");
        sanitized = IFRAME_BLOCK.matcher(sanitized).replaceAll("");
        sanitized = EVENT_HANDLER.matcher(sanitized).replaceAll("");
        sanitized = TAB_RUN.matcher(sanitized).replaceAll(" ");
        sanitized = SPACE_RUN.matcher(sanitized).replaceAll(" ");
        sanitized = BLANK_LINES.matcher(sanitized).replaceAll("\n\n");
        sanitized = sanitized.trim();
        if (sanitized.isEmpty()) {
            throw new TurnFailedException(ErrorKind.VALIDATION_ERROR, "Message has no readable content");
        }
        return sanitized;
    }

    /**
     * Title for a conversation started by this message: its first line, cut to
     * {@value #MAX_TITLE_LENGTH} characters.
     */
    public static String conversationTitle(String sanitizedMessage) {
        if (sanitizedMessage == null || sanitizedMessage.isBlank()) {
            return null;
        }
        String firstLine = sanitizedMessage.strip().split("\n", 2)[0].strip();
        if (firstLine.length() > MAX_TITLE_LENGTH) {
            firstLine = firstLine.substring(0, MAX_TITLE_LENGTH).strip();
        }
        return firstLine;
    }
}
