package com.taskchat.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskchat.AppLogger;
import com.taskchat.models.Conversation;
import com.taskchat.models.Message;
import com.taskchat.models.MessageRole;
import com.taskchat.reasoning.ReasoningEngine;
import com.taskchat.reasoning.ReasoningException;
import com.taskchat.reasoning.ReasoningMessage;
import com.taskchat.reasoning.ReasoningOutput;
import com.taskchat.reasoning.ReasoningTimeoutException;
import com.taskchat.reasoning.ReasoningUnavailableException;
import com.taskchat.reasoning.ToolCallRequest;
import com.taskchat.storage.ConversationStore;
import com.taskchat.storage.ForbiddenException;
import com.taskchat.storage.NotFoundException;
import com.taskchat.tools.ToolDescriptor;
import com.taskchat.tools.ToolExecutor;
import com.taskchat.tools.ToolInvocationResult;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one chat turn as an explicit state machine:
 * load history, store the user message, then alternate between the reasoning
 * engine and the tool executor until the engine answers, the tool-call cap is
 * reached or the turn deadline passes.
 *
 * <p>Holds no per-conversation state. Everything a turn needs is read from the
 * store when the turn starts, so any instance can serve any request.</p>
 */
public class ChatOrchestrator {

    private final ConversationStore conversationStore;
    private final ToolExecutor toolExecutor;
    private final ReasoningEngine reasoningEngine;
    private final TurnSettings settings;
    private final ExecutorService reasoningExecutor;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public ChatOrchestrator(ConversationStore conversationStore, ToolExecutor toolExecutor,
                            ReasoningEngine reasoningEngine, TurnSettings settings,
                            ExecutorService reasoningExecutor, ObjectMapper objectMapper) {
        this.conversationStore = Objects.requireNonNull(conversationStore, "conversationStore");
        this.toolExecutor = Objects.requireNonNull(toolExecutor, "toolExecutor");
        this.reasoningEngine = Objects.requireNonNull(reasoningEngine, "reasoningEngine");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.reasoningExecutor = Objects.requireNonNull(reasoningExecutor, "reasoningExecutor");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.logger = AppLogger.get();
    }

    /**
     * Runs a turn to completion.
     *
     * @return the assistant reply, or a fallback reply when reasoning failed,
     * timed out or kept requesting tools past the cap
     * @throws TurnFailedException when the input is invalid, the conversation is
     *                             not visible to the owner, or a message could not be stored
     */
    public TurnResult runTurn(TurnRequest request) {
        Objects.requireNonNull(request, "request");
        if (request.getOwner() == null || request.getOwner().isBlank()) {
            throw new IllegalArgumentException("owner is required");
        }
        Turn turn = new Turn(request, System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(settings.getTurnTimeoutMs()));
        TurnState state = TurnState.START;
        while (!state.isTerminal()) {
            state = step(state, turn);
        }
        if (turn.failure != null) {
            logger.warn("[ChatOrchestrator] Turn failed for owner " + turn.owner + ": "
                + turn.failure.getKind().getWireName());
            throw turn.failure;
        }
        if (turn.fallbackKind != null) {
            logger.warn("[ChatOrchestrator] Turn for conversation " + turn.conversationId
                + " ended with fallback " + turn.fallbackKind.getWireName()
                + " after " + turn.toolCallCount + " tool call(s)");
            return TurnResult.fallback(turn.conversationId, turn.fallbackKind, turn.invocations);
        }
        logger.info("[ChatOrchestrator] Turn completed for conversation " + turn.conversationId
            + " with " + turn.toolCallCount + " tool call(s)");
        return TurnResult.completed(turn.conversationId, turn.responseText, turn.invocations);
    }

    private TurnState step(TurnState state, Turn turn) {
        switch (state) {
            case START:
                return start(turn);
            case LOAD_HISTORY:
                return loadHistory(turn);
            case APPEND_USER_MESSAGE:
                return appendUserMessage(turn);
            case INVOKE_REASONING:
                return invokeReasoning(turn);
            case EVALUATE_REASONING_OUTPUT:
                return evaluateReasoningOutput(turn);
            case EXECUTE_TOOL:
                return executeTool(turn);
            case FEED_RESULT_BACK:
                return feedResultBack(turn);
            case APPEND_ASSISTANT_MESSAGE:
                return appendAssistantMessage(turn);
            default:
                throw new IllegalStateException("No transition from " + state);
        }
    }

    private TurnState start(Turn turn) {
        try {
            turn.message = MessageSanitizer.sanitize(turn.request.getMessage());
        } catch (TurnFailedException e) {
            return abort(turn, e);
        }
        return TurnState.LOAD_HISTORY;
    }

    private TurnState loadHistory(Turn turn) {
        String requestedId = turn.request.getConversationId();
        try {
            if (requestedId == null || requestedId.isBlank()) {
                Conversation created = conversationStore.createConversation(
                    turn.owner, MessageSanitizer.conversationTitle(turn.message));
                turn.conversationId = created.getId();
            } else {
                List<Message> history = conversationStore.listRecentMessages(
                    turn.owner, requestedId, settings.getHistoryLimit());
                turn.conversationId = requestedId;
                for (Message message : history) {
                    turn.context.add(message.getRole() == MessageRole.USER
                        ? ReasoningMessage.user(message.getContent())
                        : ReasoningMessage.assistant(message.getContent()));
                }
            }
        } catch (RuntimeException e) {
            return abort(turn, storeFailure(e, "load conversation"));
        }
        return TurnState.APPEND_USER_MESSAGE;
    }

    private TurnState appendUserMessage(Turn turn) {
        try {
            conversationStore.appendMessage(turn.owner, turn.conversationId, MessageRole.USER, turn.message, null);
        } catch (RuntimeException e) {
            return abort(turn, storeFailure(e, "store user message"));
        }
        turn.context.add(ReasoningMessage.user(turn.message));
        return TurnState.INVOKE_REASONING;
    }

    private TurnState invokeReasoning(Turn turn) {
        long remainingMs = turn.remainingMs();
        if (remainingMs <= 0) {
            return fallback(turn, ErrorKind.TURN_DEADLINE_EXCEEDED);
        }
        boolean deadlineBound = remainingMs <= settings.getReasoningTimeoutMs();
        long waitMs = Math.min(remainingMs, settings.getReasoningTimeoutMs());

        List<ReasoningMessage> snapshot = List.copyOf(turn.context);
        List<ToolDescriptor> catalog = toolExecutor.catalog();
        Future<ReasoningOutput> pending = reasoningExecutor.submit(() -> reasoningEngine.respond(snapshot, catalog));
        try {
            turn.lastOutput = pending.get(waitMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            return fallback(turn, deadlineBound ? ErrorKind.TURN_DEADLINE_EXCEEDED : ErrorKind.REASONING_TIMEOUT);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            return fallback(turn, ErrorKind.TURN_DEADLINE_EXCEEDED);
        } catch (CancellationException e) {
            return fallback(turn, ErrorKind.REASONING_UNAVAILABLE);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ReasoningTimeoutException) {
                return fallback(turn, ErrorKind.REASONING_TIMEOUT);
            }
            if (cause instanceof ReasoningUnavailableException
                && ((ReasoningUnavailableException) cause).isRateLimited()) {
                logger.warn("[ChatOrchestrator] Reasoning service is rate limiting requests");
                return fallback(turn, ErrorKind.REASONING_RATE_LIMITED);
            }
            if (cause instanceof ReasoningException) {
                logger.warn("[ChatOrchestrator] Reasoning unavailable: " + cause.getMessage());
            } else {
                logger.error("[ChatOrchestrator] Reasoning engine failed unexpectedly", cause);
            }
            return fallback(turn, ErrorKind.REASONING_UNAVAILABLE);
        }
        if (turn.lastOutput == null) {
            return fallback(turn, ErrorKind.REASONING_UNAVAILABLE);
        }
        return TurnState.EVALUATE_REASONING_OUTPUT;
    }

    private TurnState evaluateReasoningOutput(Turn turn) {
        ReasoningOutput output = turn.lastOutput;
        if (!output.hasToolCalls()) {
            turn.responseText = output.getText();
            return TurnState.APPEND_ASSISTANT_MESSAGE;
        }
        turn.context.add(ReasoningMessage.assistantToolCalls(output.getToolCalls()));
        turn.pendingCalls.addAll(output.getToolCalls());
        return TurnState.EXECUTE_TOOL;
    }

    private TurnState executeTool(Turn turn) {
        if (turn.toolCallCount >= settings.getMaxToolCalls()) {
            return fallback(turn, ErrorKind.TOOL_LOOP_EXHAUSTED);
        }
        if (turn.remainingMs() <= 0) {
            return fallback(turn, ErrorKind.TURN_DEADLINE_EXCEEDED);
        }
        ToolCallRequest call = turn.pendingCalls.poll();
        ToolInvocationResult result = toolExecutor.execute(call.getName(), call.getArguments(), turn.owner);
        turn.toolCallCount++;
        if (turn.remainingMs() <= 0) {
            // Finished after the deadline fired; the result is not used.
            return fallback(turn, ErrorKind.TURN_DEADLINE_EXCEEDED);
        }
        turn.invocations.add(result);
        turn.lastCall = call;
        turn.lastResult = result;
        return TurnState.FEED_RESULT_BACK;
    }

    private TurnState feedResultBack(Turn turn) {
        JsonNode resultNode = objectMapper.valueToTree(turn.lastResult);
        turn.context.add(ReasoningMessage.toolResult(turn.lastCall.getId(), resultNode.toString()));
        return turn.pendingCalls.isEmpty() ? TurnState.INVOKE_REASONING : TurnState.EXECUTE_TOOL;
    }

    private TurnState appendAssistantMessage(Turn turn) {
        String text = turn.responseText != null ? turn.responseText.trim() : "";
        text = truncateForStorage(text);
        turn.responseText = text;
        JsonNode toolRecord = turn.invocations.isEmpty() ? null : objectMapper.valueToTree(turn.invocations);
        try {
            conversationStore.appendMessage(turn.owner, turn.conversationId, MessageRole.ASSISTANT, text, toolRecord);
        } catch (RuntimeException e) {
            return abort(turn, storeFailure(e, "store assistant message"));
        }
        return TurnState.DONE;
    }

    /**
     * Cuts a reply to {@link Message#MAX_CONTENT_LENGTH} chars without splitting a surrogate pair.
     */
    static String truncateForStorage(String text) {
        if (text.length() <= Message.MAX_CONTENT_LENGTH) {
            return text;
        }
        int end = Message.MAX_CONTENT_LENGTH;
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }

    private TurnState fallback(Turn turn, ErrorKind kind) {
        turn.fallbackKind = kind;
        return TurnState.ABORTED;
    }

    private TurnState abort(Turn turn, TurnFailedException failure) {
        turn.failure = failure;
        return TurnState.ABORTED;
    }

    private TurnFailedException storeFailure(RuntimeException e, String action) {
        if (e instanceof NotFoundException || e instanceof ForbiddenException) {
            return new TurnFailedException(ErrorKind.NOT_FOUND, "Conversation not found", e);
        }
        if (e instanceof IllegalArgumentException) {
            return new TurnFailedException(ErrorKind.VALIDATION_ERROR, "Invalid chat request", e);
        }
        logger.error("[ChatOrchestrator] Could not " + action, e);
        return new TurnFailedException(ErrorKind.STORE_ERROR, "The conversation could not be saved. Please try again.", e);
    }

    /**
     * Working state of a single turn. Never shared between turns.
     */
    private static final class Turn {
        private final TurnRequest request;
        private final String owner;
        private final long deadlineNanos;
        private final List<ReasoningMessage> context = new ArrayList<>();
        private final Deque<ToolCallRequest> pendingCalls = new ArrayDeque<>();
        private final List<ToolInvocationResult> invocations = new ArrayList<>();

        private String message;
        private String conversationId;
        private ReasoningOutput lastOutput;
        private ToolCallRequest lastCall;
        private ToolInvocationResult lastResult;
        private int toolCallCount;
        private String responseText;
        private ErrorKind fallbackKind;
        private TurnFailedException failure;

        private Turn(TurnRequest request, long deadlineNanos) {
            this.request = request;
            this.owner = request.getOwner();
            this.deadlineNanos = deadlineNanos;
            this.conversationId = request.getConversationId();
        }

        private long remainingMs() {
            return TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
        }
    }
}
