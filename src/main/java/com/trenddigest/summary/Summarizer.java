package com.trenddigest.summary;

import com.trenddigest.model.TopicBatch;

/**
 * Turns a topic ranking into a short prose digest.
 */
public interface Summarizer {
    /**
     * @return trimmed, non-empty digest text
     */
    String summarize(TopicBatch batch) throws SummarizeException;
}
