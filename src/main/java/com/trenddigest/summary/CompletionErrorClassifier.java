package com.trenddigest.summary;

import com.trenddigest.core.retry.FailureCategory;
import com.trenddigest.data.http.HttpStatusException;
import dev.ai4j.openai4j.OpenAiHttpException;

import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Maps a failed completion call to a {@link FailureCategory}.
 * A structured HTTP status on the cause chain wins; otherwise the combined exception messages are matched
 * against known indicators, checked in the order rate limit, server unavailable, client error.
 */
public final class CompletionErrorClassifier {
    private static final int MAX_CAUSE_DEPTH = 8;

    private static final Pattern RATE_LIMIT = Pattern.compile(
            "\\b429\\b|rate[ _-]?limit|quota|too many requests");
    private static final Pattern SERVER_UNAVAILABLE = Pattern.compile(
            "\\b50[0234]\\b|service unavailable|server[ _]error|bad gateway|gateway time-?out|overloaded");
    private static final Pattern CLIENT_ERROR = Pattern.compile(
            "\\b40[0134]\\b|bad request|unauthori[sz]ed|forbidden|not found|authentication|invalid[ _]api[ _]key|invalid_request_error");

    private CompletionErrorClassifier() {
    }

    public static FailureCategory classify(Throwable error) {
        if (error == null) {
            return FailureCategory.UNCLASSIFIED;
        }
        OptionalInt status = structuredStatus(error);
        if (status.isPresent()) {
            FailureCategory byStatus = fromStatus(status.getAsInt());
            if (byStatus != null) {
                return byStatus;
            }
        }
        return fromMessage(collectMessages(error));
    }

    static FailureCategory fromStatus(int status) {
        if (status == 429) {
            return FailureCategory.RATE_LIMITED;
        }
        if (status >= 500 && status <= 599) {
            return FailureCategory.SERVER_UNAVAILABLE;
        }
        if (status == 400 || status == 401 || status == 403 || status == 404) {
            return FailureCategory.CLIENT_ERROR;
        }
        return null;
    }

    static FailureCategory fromMessage(String message) {
        String msg = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (RATE_LIMIT.matcher(msg).find()) {
            return FailureCategory.RATE_LIMITED;
        }
        if (SERVER_UNAVAILABLE.matcher(msg).find()) {
            return FailureCategory.SERVER_UNAVAILABLE;
        }
        if (CLIENT_ERROR.matcher(msg).find()) {
            return FailureCategory.CLIENT_ERROR;
        }
        return FailureCategory.UNCLASSIFIED;
    }

    private static OptionalInt structuredStatus(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof HttpStatusException) {
                return OptionalInt.of(((HttpStatusException) current).statusCode());
            }
            if (current instanceof OpenAiHttpException) {
                return OptionalInt.of(((OpenAiHttpException) current).code());
            }
            current = current.getCause();
        }
        return OptionalInt.empty();
    }

    /**
     * Client libraries often wrap the HTTP failure; the status text may sit on any level of the chain.
     */
    static String collectMessages(Throwable error) {
        StringBuilder sb = new StringBuilder();
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current.getMessage() != null) {
                if (sb.length() > 0) {
                    sb.append(" | ");
                }
                sb.append(current.getMessage());
            }
            current = current.getCause();
        }
        return sb.toString();
    }

    static String describe(Throwable error) {
        String messages = collectMessages(error);
        return messages.isBlank() ? error.getClass().getSimpleName() : messages;
    }
}
