package com.trenddigest.output;

import com.trenddigest.model.Topic;
import com.trenddigest.model.TopicBatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Writes the raw ranking and the finished summary under the outputs directory.
 */
public final class AuditWriter implements AuditSink {
    private static final Logger LOG = LogManager.getLogger(AuditWriter.class);
    static final String RAW_FILE = "weibo_topics_raw.txt";
    static final String SUMMARY_FILE = "weibo_summary.md";

    private final Path outputsDir;
    private final Clock clock;

    public AuditWriter(Path outputsDir, Clock clock) {
        this.outputsDir = outputsDir;
        this.clock = clock;
    }

    @Override
    public void recordTopics(TopicBatch batch) throws IOException {
        StringBuilder sb = new StringBuilder();
        List<Topic> topics = batch.topics;
        for (int i = 0; i < topics.size(); i++) {
            Topic topic = topics.get(i);
            sb.append(i + 1).append(". [").append(topic.tag).append("] ")
                    .append(topic.word)
                    .append(" (热度: ").append(topic.weight).append(")\n");
        }
        Path path = write(RAW_FILE, sb.toString());
        LOG.info("Raw topics saved to {}", path);
    }

    @Override
    public void recordSummary(String summary, TopicBatch batch) throws IOException {
        StringBuilder sb = new StringBuilder();
        sb.append("# 微博热搜总结 - ").append(LocalDate.now(clock)).append("\n\n");
        sb.append(summary == null ? "" : summary);
        sb.append("\n\n---\n\n");
        sb.append("## 完整热搜榜单\n\n");
        sb.append(formatTopics(batch));
        Path path = write(SUMMARY_FILE, sb.toString());
        LOG.info("Summary saved to {}", path);
    }

    /**
     * Full list with scaled heat, e.g. {@code 1. [热] 话题 (热度: 1.2万)}.
     */
    static String formatTopics(TopicBatch batch) {
        if (batch == null || batch.isEmpty()) {
            return "暂无热搜数据";
        }
        StringBuilder sb = new StringBuilder();
        List<Topic> topics = batch.topics;
        for (int i = 0; i < topics.size(); i++) {
            Topic topic = topics.get(i);
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(i + 1).append(". ")
                    .append(topic.hasTag() ? "[" + topic.tag + "]" : "")
                    .append(' ').append(topic.word)
                    .append(" (热度: ").append(HeatFormatter.formatHeat(topic.weight)).append(')');
        }
        return sb.toString();
    }

    private Path write(String fileName, String content) throws IOException {
        Files.createDirectories(outputsDir);
        Path path = outputsDir.resolve(fileName);
        Files.writeString(path, content, StandardCharsets.UTF_8);
        return path;
    }
}
