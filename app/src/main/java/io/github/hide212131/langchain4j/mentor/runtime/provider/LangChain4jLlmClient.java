package io.github.hide212131.langchain4j.mentor.runtime.provider;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.TokenUsage;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * LangChain4j wrapper shared by the intent classifier and the LLM collaborators.
 */
public final class LangChain4jLlmClient {

    private final ChatModel chatModel;
    private final Clock clock;
    private final String modelName;
    private final AtomicInteger callCount = new AtomicInteger();
    private final AtomicLong cumulativeDurationMs = new AtomicLong();
    private final AtomicInteger cumulativeInputTokens = new AtomicInteger();
    private final AtomicInteger cumulativeOutputTokens = new AtomicInteger();

    LangChain4jLlmClient(ChatModel chatModel, Clock clock, String modelName) {
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.modelName = modelName;
    }

    public static LangChain4jLlmClient from(LlmConfiguration configuration) {
        return from(configuration, new OpenAiChatModelFactory());
    }

    static LangChain4jLlmClient from(LlmConfiguration configuration, ChatModelFactory factory) {
        Objects.requireNonNull(configuration, "configuration");
        if (configuration.provider() == LlmProvider.MOCK) {
            return fake();
        }
        if (configuration.openAiApiKey() == null) {
            throw new IllegalStateException("OPENAI_API_KEY must be set");
        }
        return new LangChain4jLlmClient(
                factory.create(configuration), Clock.systemUTC(), configuration.openAiModel());
    }

    public static LangChain4jLlmClient usingChatModel(ChatModel chatModel) {
        return new LangChain4jLlmClient(chatModel, Clock.systemUTC(), null);
    }

    public static LangChain4jLlmClient fake() {
        return new LangChain4jLlmClient(new FakeChatModel(), Clock.systemUTC(), null);
    }

    public CompletionResult complete(String prompt) {
        Instant start = clock.instant();
        ChatRequest request = ChatRequest.builder()
                .messages(List.of(UserMessage.from(prompt)))
                .build();
        ChatResponse response = chatModel.chat(request);
        long durationMs = Duration.between(start, clock.instant()).toMillis();
        AiMessage aiMessage = response.aiMessage();
        String content = aiMessage != null && aiMessage.text() != null ? aiMessage.text() : "";
        TokenUsage usage = response.tokenUsage();
        recordMetrics(usage, durationMs);
        return new CompletionResult(content, usage, durationMs);
    }

    public ChatModel chatModel() {
        return chatModel;
    }

    public String modelName() {
        return modelName;
    }

    public ProviderMetrics metrics() {
        return new ProviderMetrics(
                callCount.get(),
                cumulativeDurationMs.get(),
                cumulativeInputTokens.get(),
                cumulativeOutputTokens.get());
    }

    public record CompletionResult(String content, TokenUsage tokenUsage, long durationMs) {}

    public record ProviderMetrics(int callCount, long totalDurationMs, int totalInputTokens, int totalOutputTokens) {
        public int totalTokenCount() {
            return totalInputTokens + totalOutputTokens;
        }
    }

    interface ChatModelFactory {
        ChatModel create(LlmConfiguration configuration);
    }

    private static final class OpenAiChatModelFactory implements ChatModelFactory {

        @Override
        public ChatModel create(LlmConfiguration configuration) {
            return OpenAiChatModel.builder()
                    .apiKey(configuration.openAiApiKey())
                    .modelName(configuration.openAiModel())
                    .timeout(configuration.timeout())
                    .build();
        }
    }

    /** Offline model: answers every request with an empty JSON object. */
    private static final class FakeChatModel implements ChatModel {
        @Override
        public ChatResponse doChat(ChatRequest request) {
            return ChatResponse.builder()
                    .aiMessage(AiMessage.from("{}"))
                    .tokenUsage(new TokenUsage(0, 0, 0))
                    .build();
        }
    }

    private void recordMetrics(TokenUsage usage, long durationMs) {
        callCount.incrementAndGet();
        cumulativeDurationMs.addAndGet(durationMs);
        if (usage != null) {
            if (usage.inputTokenCount() != null) {
                cumulativeInputTokens.addAndGet(usage.inputTokenCount());
            }
            if (usage.outputTokenCount() != null) {
                cumulativeOutputTokens.addAndGet(usage.outputTokenCount());
            }
        }
    }
}
