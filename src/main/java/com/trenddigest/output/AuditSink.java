package com.trenddigest.output;

import com.trenddigest.model.TopicBatch;

import java.io.IOException;

/**
 * Keeps intermediate results for later inspection. Provenance only: nothing recorded here counts as delivery.
 */
public interface AuditSink {
    AuditSink NONE = new AuditSink() {
        @Override
        public void recordTopics(TopicBatch batch) {
        }

        @Override
        public void recordSummary(String summary, TopicBatch batch) {
        }
    };

    void recordTopics(TopicBatch batch) throws IOException;

    void recordSummary(String summary, TopicBatch batch) throws IOException;
}
