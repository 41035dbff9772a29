package com.taskchat.reasoning;

import com.taskchat.tools.ToolDescriptor;

import java.util.List;

/**
 * Natural-language component that either answers or asks for tool calls.
 * Implementations hold no conversation state between calls.
 */
public interface ReasoningEngine {

    /**
     * @param messages conversation context, oldest first, ending with the latest user input
     *                 or tool results
     * @param tools    the callable catalog
     */
    ReasoningOutput respond(List<ReasoningMessage> messages, List<ToolDescriptor> tools)
        throws ReasoningException;
}
