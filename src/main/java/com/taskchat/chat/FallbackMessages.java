package com.taskchat.chat;

/**
 * Fixed replies returned when a turn has to stop early. These are never stored.
 */
public final class FallbackMessages {

    public static final String REASONING_TIMEOUT =
        "I'm taking longer than usual to process your request. Please try again, "
            + "or try a simpler request such as \"show my tasks\".";
    public static final String REASONING_UNAVAILABLE =
        "I can't reach my assistant service right now. Please try your request again in a moment.";
    public static final String REASONING_RATE_LIMITED =
        "I've hit a temporary API limit. Please try again in a moment.";
    public static final String TOOL_LOOP_EXHAUSTED =
        "Sorry, I couldn't finish that request. Please try breaking it into smaller steps.";

    private FallbackMessages() {
    }

    public static String forKind(ErrorKind kind) {
        if (kind == null) {
            return REASONING_UNAVAILABLE;
        }
        switch (kind) {
            case REASONING_TIMEOUT:
            case TURN_DEADLINE_EXCEEDED:
                return REASONING_TIMEOUT;
            case REASONING_RATE_LIMITED:
                return REASONING_RATE_LIMITED;
            case TOOL_LOOP_EXHAUSTED:
                return TOOL_LOOP_EXHAUSTED;
            case REASONING_UNAVAILABLE:
            default:
                return REASONING_UNAVAILABLE;
        }
    }
}
