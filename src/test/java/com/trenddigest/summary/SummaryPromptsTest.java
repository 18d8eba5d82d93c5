package com.trenddigest.summary;

import com.trenddigest.model.Topic;
import com.trenddigest.model.TopicBatch;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SummaryPromptsTest {

    @Test
    void buildTopicContent_shouldListEveryTopicUnderItsRank() {
        TopicBatch batch = TopicBatch.of(List.of(
                new Topic("热", "第一条", "12345"),
                new Topic("", "", "9"),
                new Topic("", "第三条\n换行", null)
        ));

        String content = SummaryPrompts.buildTopicContent(batch);

        assertEquals("1. [热] 第一条 (热度: 12345)\n2. []  (热度: 9)\n3. [] 第三条 换行 (热度: 0)", content);
    }

    @Test
    void buildTopicContent_shouldBeEmptyOnlyForEmptyBatch() {
        assertEquals("", SummaryPrompts.buildTopicContent(TopicBatch.of(List.of())));
        assertEquals("", SummaryPrompts.buildTopicContent(null));
        assertEquals("1. [热]  (热度: 100)", SummaryPrompts.buildTopicContent(TopicBatch.of(List.of(new Topic("热", "", "100")))));
    }

    @Test
    void buildPrompt_shouldEmbedContentAndAskForChinese() {
        String prompt = SummaryPrompts.buildPrompt("1. [热] 话题 (热度: 1)");

        assertTrue(prompt.startsWith("请对以下微博热搜话题进行智能总结和分析"));
        assertTrue(prompt.contains("1. [热] 话题 (热度: 1)"));
        assertTrue(prompt.contains("使用中文输出"));
    }
}
