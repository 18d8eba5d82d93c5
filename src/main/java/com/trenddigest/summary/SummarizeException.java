package com.trenddigest.summary;

import com.trenddigest.core.Stage;
import com.trenddigest.core.StageException;

/**
 * Summarization cannot produce text: empty input, a client error from the model provider, or retries exhausted.
 */
public class SummarizeException extends StageException {
    public SummarizeException(String message) {
        super(Stage.SUMMARIZE, message);
    }

    public SummarizeException(String message, Throwable cause) {
        super(Stage.SUMMARIZE, message, cause);
    }
}
