package com.taskchat.chat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskchat.reasoning.ReasoningEngine;
import com.taskchat.reasoning.ReasoningException;
import com.taskchat.reasoning.ReasoningMessage;
import com.taskchat.reasoning.ReasoningOutput;
import com.taskchat.reasoning.ReasoningTimeoutException;
import com.taskchat.reasoning.ReasoningUnavailableException;
import com.taskchat.reasoning.ToolCallRequest;
import com.taskchat.tools.ToolDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reasoning engine that plays back a fixed script, one step per call.
 */
public class ScriptedReasoningEngine implements ReasoningEngine {

    public interface Step {
        ReasoningOutput respond(List<ReasoningMessage> messages) throws ReasoningException;
    }

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Queue<Step> steps = new ConcurrentLinkedQueue<>();
    private final List<List<ReasoningMessage>> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger callIds = new AtomicInteger();

    public ScriptedReasoningEngine then(Step step) {
        steps.add(step);
        return this;
    }

    public ScriptedReasoningEngine thenReply(String text) {
        return then(messages -> ReasoningOutput.text(text));
    }

    public ScriptedReasoningEngine thenCall(String tool, String argumentsJson) {
        ToolCallRequest call = call(tool, argumentsJson);
        return then(messages -> ReasoningOutput.toolCalls(List.of(call)));
    }

    public ScriptedReasoningEngine thenCalls(List<ToolCallRequest> calls) {
        return then(messages -> ReasoningOutput.toolCalls(calls));
    }

    public ScriptedReasoningEngine thenSleep(long millis) {
        return then(messages -> {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ReasoningTimeoutException("interrupted", e);
            }
            return ReasoningOutput.text("too late");
        });
    }

    public ScriptedReasoningEngine thenFail() {
        return then(messages -> {
            throw new ReasoningUnavailableException("service down", 503, null);
        });
    }

    public ScriptedReasoningEngine thenRateLimited() {
        return then(messages -> {
            throw new ReasoningUnavailableException("too many requests", 429, null);
        });
    }

    public ToolCallRequest call(String tool, String argumentsJson) {
        try {
            return new ToolCallRequest("call_" + callIds.incrementAndGet(), tool, MAPPER.readTree(argumentsJson));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Bad script arguments: " + argumentsJson, e);
        }
    }

    public List<List<ReasoningMessage>> getRequests() {
        return new ArrayList<>(requests);
    }

    @Override
    public ReasoningOutput respond(List<ReasoningMessage> messages, List<ToolDescriptor> tools)
        throws ReasoningException {
        requests.add(List.copyOf(messages));
        Step step = steps.poll();
        if (step == null) {
            throw new ReasoningUnavailableException("script exhausted");
        }
        return step.respond(messages);
    }
}
