package com.trenddigest.summary;

import com.trenddigest.core.retry.CallOutcome;
import com.trenddigest.core.retry.FailureCategory;
import com.trenddigest.core.retry.RetryExecutor;
import com.trenddigest.core.retry.RetryPolicy;
import com.trenddigest.core.retry.Sleeper;
import com.trenddigest.model.TopicBatch;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Locale;

/**
 * Summarizes the hot-search board through a chat model, retrying transient failures.
 *
 * <p>Per attempt: a reply without text is retried at once; a thrown error is classified by
 * {@link CompletionErrorClassifier}. Client errors end the loop immediately, rate limits back off
 * {@code baseDelay * (attempt + 1) * 2}, everything else backs off {@code baseDelay * (attempt + 1)}.
 */
public final class TrendSummarizer implements Summarizer {
    private static final Logger LOG = LogManager.getLogger(TrendSummarizer.class);

    private final ChatLanguageModel chatModel;
    private final RetryExecutor retry;

    public TrendSummarizer(ChatLanguageModel chatModel, RetryPolicy policy, Sleeper sleeper) {
        if (chatModel == null) {
            throw new IllegalArgumentException("chatModel is required");
        }
        this.chatModel = chatModel;
        this.retry = new RetryExecutor("summarize", policy, sleeper);
    }

    @Override
    public String summarize(TopicBatch batch) throws SummarizeException {
        if (batch == null || batch.isEmpty()) {
            throw new SummarizeException("no topics to summarize");
        }
        String content = SummaryPrompts.buildTopicContent(batch);
        if (content.isBlank()) {
            throw new SummarizeException("topic content is empty, nothing to summarize");
        }
        String prompt = SummaryPrompts.buildPrompt(content);
        LOG.info("Summarizing {} topics, prompt length={} chars", Math.min(batch.size(), SummaryPrompts.MAX_PROMPT_TOPICS), prompt.length());

        CallOutcome<String> outcome = retry.execute(attemptIndex -> attempt(prompt, attemptIndex));
        if (outcome.isSuccess()) {
            LOG.info("Summary ready, length={} chars", outcome.value.length());
            return outcome.value;
        }
        throw new SummarizeException(outcome.reason, outcome.cause);
    }

    private CallOutcome<String> attempt(String prompt, int attemptIndex) {
        Response<AiMessage> response;
        try {
            response = chatModel.generate(List.<ChatMessage>of(UserMessage.from(prompt)));
        } catch (RuntimeException e) {
            FailureCategory category = CompletionErrorClassifier.classify(e);
            String reason = category.name().toLowerCase(Locale.ROOT) + ": " + CompletionErrorClassifier.describe(e);
            if (!category.retryable()) {
                return CallOutcome.fatal("completion request rejected, not retrying: " + reason, e);
            }
            return CallOutcome.retryable(reason, category.backoff(retry.policy().baseDelay(), attemptIndex), e);
        }

        String missing = missingTextReason(response);
        if (missing != null) {
            return CallOutcome.retryable(missing, FailureCategory.EMPTY_RESPONSE.backoff(retry.policy().baseDelay(), attemptIndex));
        }
        return CallOutcome.success(response.content().text().trim());
    }

    /**
     * @return why the reply is unusable, or {@code null} when it carries non-blank text
     */
    static String missingTextReason(Response<AiMessage> response) {
        if (response == null || response.content() == null) {
            return "completion returned no choices";
        }
        String text = response.content().text();
        if (text == null) {
            return "completion choice has no text";
        }
        if (text.trim().isEmpty()) {
            return "completion text is blank";
        }
        return null;
    }
}
