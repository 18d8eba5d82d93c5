package com.trenddigest.model;

/**
 * One entry of the hot-search board. Rank is the entry's position in its {@link TopicBatch}.
 */
public final class Topic {
    public final String tag;
    public final String word;
    /** Popularity score exactly as the provider sent it; may be a numeric string. */
    public final String weight;

    public Topic(String tag, String word, String weight) {
        this.tag = tag == null ? "" : tag.trim();
        this.word = word == null ? "" : word.trim();
        this.weight = weight == null ? "0" : weight.trim();
    }

    public boolean hasTag() {
        return !tag.isEmpty();
    }

    @Override
    public String toString() {
        return "Topic{tag='" + tag + "', word='" + word + "', weight='" + weight + "'}";
    }
}
