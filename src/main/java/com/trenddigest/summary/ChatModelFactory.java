package com.trenddigest.summary;

import com.trenddigest.config.Config;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;

import java.time.Duration;
import java.util.Locale;

/**
 * Builds the chat model named by {@code summarizer.provider}: {@code openai} (any OpenAI-compatible endpoint,
 * DeepSeek by default) or {@code ollama}.
 * The client's own retry is limited to a single call; {@link TrendSummarizer} owns retrying.
 */
public final class ChatModelFactory {
    public static final String PROVIDER_OPENAI = "openai";
    public static final String PROVIDER_OLLAMA = "ollama";

    private ChatModelFactory() {
    }

    public static String provider(Config config) {
        return config.getString("summarizer.provider", PROVIDER_OPENAI).toLowerCase(Locale.ROOT);
    }

    public static ChatLanguageModel create(Config config) {
        String provider = provider(config);
        Duration timeout = Duration.ofSeconds(Math.max(5, config.getInt("summarizer.timeout_sec", 60)));
        double temperature = config.getDouble("summarizer.temperature", 0.7);
        int maxTokens = Math.max(1, config.getInt("summarizer.max_tokens", 1000));

        switch (provider) {
            case PROVIDER_OPENAI:
                return OpenAiChatModel.builder()
                        .baseUrl(config.getString("summarizer.base_url"))
                        .apiKey(config.requireString("summarizer.api_key"))
                        .modelName(config.getString("summarizer.model"))
                        .temperature(temperature)
                        .maxTokens(maxTokens)
                        .timeout(timeout)
                        .maxRetries(1)
                        .build();
            case PROVIDER_OLLAMA:
                return OllamaChatModel.builder()
                        .baseUrl(config.getString("summarizer.ollama.base_url"))
                        .modelName(config.getString("summarizer.ollama.model"))
                        .temperature(temperature)
                        .numPredict(maxTokens)
                        .timeout(timeout)
                        .maxRetries(1)
                        .build();
            default:
                throw new IllegalArgumentException("unknown summarizer.provider: " + provider
                        + " (expected " + PROVIDER_OPENAI + " or " + PROVIDER_OLLAMA + ")");
        }
    }
}
