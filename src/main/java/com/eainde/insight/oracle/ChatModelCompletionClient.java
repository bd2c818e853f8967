package com.eainde.insight.oracle;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link CompletionClient} backed by a langchain4j {@link ChatModel}.
 *
 * <p>The model call runs on {@code callExecutor} so that the request timeout is enforced even
 * when the underlying HTTP client does not honour it. Without a model (no proxy URL or key
 * configured) every call fails fast with {@link OracleUnavailableException} and no network I/O.
 */
@Slf4j
public class ChatModelCompletionClient implements CompletionClient {

    private final ChatModel chatModel;
    private final Executor callExecutor;
    private final UsageTracker usageTracker;

    public ChatModelCompletionClient(ChatModel chatModel, Executor callExecutor, UsageTracker usageTracker) {
        this.chatModel = chatModel;
        this.callExecutor = callExecutor;
        this.usageTracker = usageTracker;
    }

    public static ChatModelCompletionClient unconfigured(UsageTracker usageTracker) {
        return new ChatModelCompletionClient(null, Runnable::run, usageTracker);
    }

    public boolean isConfigured() {
        return chatModel != null;
    }

    @Override
    public Completion complete(CompletionRequest request) throws OracleUnavailableException {
        if (chatModel == null) {
            throw new OracleUnavailableException("LLM proxy is not configured (base URL or API key missing)");
        }

        ChatRequest chatRequest = toChatRequest(request);
        CompletableFuture<ChatResponse> future =
                CompletableFuture.supplyAsync(() -> chatModel.chat(chatRequest), callExecutor);

        ChatResponse response;
        try {
            response = future.get(request.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new OracleUnavailableException(
                    "[" + request.purpose() + "] LLM call timed out after " + request.timeout().toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new OracleUnavailableException(
                    "[" + request.purpose() + "] LLM call failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleUnavailableException("[" + request.purpose() + "] interrupted waiting for LLM", e);
        }

        if (response == null || response.aiMessage() == null) {
            throw new OracleUnavailableException("[" + request.purpose() + "] LLM returned no message");
        }

        usageTracker.record(request.purpose(), response.tokenUsage());
        log.debug("[{}] completion finished: reason={}, chars={}",
                request.purpose(), response.finishReason(),
                response.aiMessage().text() == null ? 0 : response.aiMessage().text().length());

        return new Completion(response.aiMessage().text(), response.finishReason(), response.tokenUsage());
    }

    private ChatRequest toChatRequest(CompletionRequest request) {
        List<ChatMessage> messages = new ArrayList<>(2);
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.systemPrompt()));
        }
        messages.add(UserMessage.from(request.userPrompt()));

        ChatRequest.Builder builder = ChatRequest.builder()
                .messages(messages)
                .maxOutputTokens(request.maxTokens());
        if (request.wantJson()) {
            builder.responseFormat(ResponseFormat.JSON);
        }
        return builder.build();
    }
}
