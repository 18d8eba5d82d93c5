package com.trenddigest.output;

import com.trenddigest.model.Topic;
import com.trenddigest.model.TopicBatch;
import com.trenddigest.utils.TextFormatter;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders the digest mail: HTML through the classpath Thymeleaf template, plain text in code.
 * Both bodies show at most {@link #MAX_DISPLAY_ROWS} topics; the summary is shown as plain text.
 */
public final class DigestMailRenderer {
    public static final int MAX_DISPLAY_ROWS = 30;
    static final String TEMPLATE = "digest_mail";

    private static final DateTimeFormatter SUBJECT_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter HEADER_DATE = DateTimeFormatter.ofPattern("yyyy年MM月dd日");
    private static final DateTimeFormatter FOOTER_TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final TemplateEngine templateEngine;
    private final String subjectPrefix;

    public DigestMailRenderer(String subjectPrefix) {
        ClassLoaderTemplateResolver resolver = new ClassLoaderTemplateResolver();
        resolver.setPrefix("templates/");
        resolver.setSuffix(".html");
        resolver.setTemplateMode(TemplateMode.HTML);
        resolver.setCharacterEncoding("UTF-8");
        resolver.setCacheable(false);

        this.templateEngine = new TemplateEngine();
        this.templateEngine.setTemplateResolver(resolver);
        this.subjectPrefix = subjectPrefix == null || subjectPrefix.isBlank() ? "微博热搜榜" : subjectPrefix.trim();
    }

    public RenderedDigest render(String summary, TopicBatch batch, ZonedDateTime now) {
        List<TopicRow> rows = rows(batch);
        String safeSummary = TextFormatter.cleanSummary(summary);

        Context context = new Context(Locale.ROOT);
        context.setVariable("title", subjectPrefix);
        context.setVariable("dateLabel", HEADER_DATE.format(now));
        context.setVariable("summary", safeSummary);
        context.setVariable("rows", rows);
        context.setVariable("rowLimit", MAX_DISPLAY_ROWS);
        context.setVariable("generatedAt", FOOTER_TS.format(now));
        String html = templateEngine.process(TEMPLATE, context);

        String subject = subjectPrefix + " - " + SUBJECT_DATE.format(now);
        return new RenderedDigest(subject, html, renderText(safeSummary, rows, batch, now), rows.size());
    }

    static List<TopicRow> rows(TopicBatch batch) {
        if (batch == null) {
            return List.of();
        }
        List<Topic> head = batch.head(MAX_DISPLAY_ROWS);
        List<TopicRow> rows = new ArrayList<>(head.size());
        for (int i = 0; i < head.size(); i++) {
            rows.add(new TopicRow(i + 1, head.get(i)));
        }
        return rows;
    }

    private String renderText(String summary, List<TopicRow> rows, TopicBatch batch, ZonedDateTime now) {
        StringBuilder sb = new StringBuilder(2048);
        sb.append(subjectPrefix).append('\n');
        sb.append("日期：").append(SUBJECT_DATE.format(now)).append('\n');
        sb.append("共 ").append(batch == null ? 0 : batch.size()).append(" 个热搜话题\n\n");
        sb.append("AI 总结：\n").append(summary).append("\n\n");
        sb.append("热搜榜单（Top ").append(MAX_DISPLAY_ROWS).append("）：\n");
        for (TopicRow row : rows) {
            sb.append(row.getRank()).append(". ");
            if (row.isTagged()) {
                sb.append('[').append(row.getTag()).append("] ");
            }
            sb.append(row.getWord()).append(" (热度: ").append(row.getHeat()).append(")\n");
            sb.append("   ").append(row.getUrl()).append('\n');
        }
        return sb.toString();
    }
}
