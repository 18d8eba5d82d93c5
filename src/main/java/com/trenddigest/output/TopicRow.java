package com.trenddigest.output;

import com.trenddigest.model.Topic;

/**
 * One rendered table row. Getters are read by the mail template.
 */
public final class TopicRow {
    private final int rank;
    private final String tag;
    private final String tagColor;
    private final String word;
    private final String url;
    private final String heat;

    TopicRow(int rank, Topic topic) {
        this.rank = rank;
        this.tag = topic.tag;
        this.tagColor = HeatFormatter.tagColor(topic.tag);
        this.word = topic.word;
        this.url = HeatFormatter.searchUrl(topic.word);
        this.heat = HeatFormatter.formatHeat(topic.weight);
    }

    public int getRank() {
        return rank;
    }

    public String getTag() {
        return tag;
    }

    public boolean isTagged() {
        return !tag.isEmpty();
    }

    public String getTagColor() {
        return tagColor;
    }

    public String getWord() {
        return word;
    }

    public String getUrl() {
        return url;
    }

    public String getHeat() {
        return heat;
    }
}
