package com.trenddigest.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class TopicBatchTest {

    @Test
    void truncate_shouldKeepOrderAndNeverPad() {
        List<Topic> topics = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            topics.add(new Topic("", "t" + i, String.valueOf(i)));
        }
        TopicBatch batch = TopicBatch.of(topics);

        TopicBatch cut = batch.truncate(3);

        assertEquals(3, cut.size());
        assertEquals("t3", cut.topics.get(2).word);
        assertSame(batch, batch.truncate(50));
        assertEquals(5, batch.head(30).size());
    }

    @Test
    void constructor_shouldDropNullsAndNormalizeFields() {
        TopicBatch batch = TopicBatch.of(Arrays.asList(new Topic(null, " w ", null), null));

        assertEquals(1, batch.size());
        assertEquals("w", batch.topics.get(0).word);
        assertEquals("0", batch.topics.get(0).weight);
        assertEquals("", batch.topics.get(0).tag);
    }
}
