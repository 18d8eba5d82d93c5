package com.trenddigest.output;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Display helpers for topic weights, tags and links.
 */
public final class HeatFormatter {
    static final long WAN = 10_000L;
    static final String SEARCH_URL = "https://s.weibo.com/weibo?q=";

    private HeatFormatter() {
    }

    /**
     * 12345 → {@code 1.2万}, 999 → {@code 999}. Anything that is not an integer is shown as sent.
     * The one decimal is rounded half-even on the exact binary value of the quotient, so 12500 gives {@code 1.2万}.
     */
    public static String formatHeat(String raw) {
        String value = raw == null ? "" : raw.trim();
        long heat;
        try {
            heat = Long.parseLong(value);
        } catch (NumberFormatException e) {
            return value;
        }
        if (heat >= WAN) {
            return new BigDecimal(heat / (double) WAN).setScale(1, RoundingMode.HALF_EVEN).toPlainString() + "万";
        }
        return Long.toString(heat);
    }

    public static String searchUrl(String word) {
        return SEARCH_URL + URLEncoder.encode(word == null ? "" : word, StandardCharsets.UTF_8);
    }

    public static String tagColor(String tag) {
        if ("热".equals(tag)) {
            return "#ff6b6b";
        }
        if ("新".equals(tag)) {
            return "#4ecdc4";
        }
        return "#95e1d3";
    }
}
