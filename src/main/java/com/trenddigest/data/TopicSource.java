package com.trenddigest.data;

import com.trenddigest.model.TopicBatch;

/**
 * Supplies the current topic ranking.
 */
public interface TopicSource {
    /**
     * @param limit maximum number of topics to return; longer rankings are cut, shorter ones are not padded
     */
    TopicBatch fetch(int limit) throws TopicFetchException;
}
