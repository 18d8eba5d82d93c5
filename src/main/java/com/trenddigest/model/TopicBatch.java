package com.trenddigest.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, read-only topic ranking as fetched. Index 0 is rank 1.
 */
public final class TopicBatch {
    public static final int DEFAULT_LIMIT = 50;

    public final List<Topic> topics;

    public TopicBatch(List<Topic> topics) {
        List<Topic> copy = new ArrayList<>();
        if (topics != null) {
            for (Topic topic : topics) {
                if (topic != null) {
                    copy.add(topic);
                }
            }
        }
        this.topics = List.copyOf(copy);
    }

    public static TopicBatch of(List<Topic> topics) {
        return new TopicBatch(topics);
    }

    public boolean isEmpty() {
        return topics.isEmpty();
    }

    public int size() {
        return topics.size();
    }

    /**
     * First {@code n} topics, or all of them when the batch is shorter. Never pads.
     */
    public List<Topic> head(int n) {
        if (n <= 0) {
            return List.of();
        }
        if (topics.size() <= n) {
            return topics;
        }
        return topics.subList(0, n);
    }

    public TopicBatch truncate(int limit) {
        if (limit <= 0 || topics.size() <= limit) {
            return this;
        }
        return new TopicBatch(topics.subList(0, limit));
    }
}
