package com.trenddigest.summary;

import com.trenddigest.model.Topic;
import com.trenddigest.model.TopicBatch;

import java.util.List;

public final class SummaryPrompts {
    /** Topics folded into the prompt, to bound request size. */
    public static final int MAX_PROMPT_TOPICS = 30;

    private SummaryPrompts() {
    }

    /**
     * One line per topic: {@code rank. [tag] word (热度: weight)}. Every topic is listed, a blank word included,
     * so the line number always equals the board rank. Empty for an empty batch.
     */
    public static String buildTopicContent(TopicBatch batch) {
        if (batch == null || batch.isEmpty()) {
            return "";
        }
        List<Topic> head = batch.head(MAX_PROMPT_TOPICS);
        StringBuilder sb = new StringBuilder(head.size() * 32);
        for (int i = 0; i < head.size(); i++) {
            Topic topic = head.get(i);
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(i + 1).append(". [").append(safe(topic.tag)).append("] ")
                    .append(safe(topic.word))
                    .append(" (热度: ").append(safe(topic.weight)).append(")");
        }
        return sb.toString();
    }

    public static String buildPrompt(String topicContent) {
        StringBuilder sb = new StringBuilder(1024 + (topicContent == null ? 0 : topicContent.length()));
        sb.append("请对以下微博热搜话题进行智能总结和分析：\n\n");
        sb.append(topicContent == null ? "" : topicContent).append("\n\n");
        sb.append("要求：\n");
        sb.append("1. 用简洁的语言概括当前的热点话题和趋势\n");
        sb.append("2. 突出最受关注的热搜内容（前5-10个）\n");
        sb.append("3. 分析这些热搜背后反映的社会现象或热点事件\n");
        sb.append("4. 如果有明显的主题分类（如娱乐、科技、社会等），可以分类说明\n");
        sb.append("5. 总结字数控制在 300-500 字\n");
        sb.append("6. 使用中文输出\n\n");
        sb.append("请开始总结：");
        return sb.toString();
    }

    private static String safe(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\r", " ")
                .replace("\n", " ")
                .trim();
    }
}
