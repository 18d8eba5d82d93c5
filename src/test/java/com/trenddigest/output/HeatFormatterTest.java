package com.trenddigest.output;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HeatFormatterTest {

    @Test
    void formatHeat_shouldScaleLargeValuesToWan() {
        assertEquals("1.2万", HeatFormatter.formatHeat("12345"));
        assertEquals("1.0万", HeatFormatter.formatHeat("10000"));
        assertEquals("123.5万", HeatFormatter.formatHeat("1234567"));
    }

    @Test
    void formatHeat_shouldRoundTiesToEven() {
        assertEquals("1.2万", HeatFormatter.formatHeat("12500"));
        assertEquals("1.1万", HeatFormatter.formatHeat("11500"));
        assertEquals("1.4万", HeatFormatter.formatHeat("13500"));
        assertEquals("1.3万", HeatFormatter.formatHeat("12501"));
    }

    @Test
    void formatHeat_shouldKeepSmallOrNonNumericValues() {
        assertEquals("999", HeatFormatter.formatHeat("999"));
        assertEquals("abc", HeatFormatter.formatHeat("abc"));
        assertEquals("", HeatFormatter.formatHeat(null));
    }

    @Test
    void searchUrl_shouldEncodeWord() {
        assertEquals("https://s.weibo.com/weibo?q=%E7%83%AD+%E6%90%9C", HeatFormatter.searchUrl("热 搜"));
    }

    @Test
    void tagColor_shouldMapKnownTags() {
        assertEquals("#ff6b6b", HeatFormatter.tagColor("热"));
        assertEquals("#4ecdc4", HeatFormatter.tagColor("新"));
        assertEquals("#95e1d3", HeatFormatter.tagColor("沸"));
    }
}
