package com.trenddigest.output;

import com.trenddigest.model.TopicBatch;

/**
 * Delivers a finished digest.
 */
public interface Notifier {
    void deliver(String summary, TopicBatch batch) throws DeliveryException;
}
