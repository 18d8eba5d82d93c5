package com.trenddigest.utils;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.util.regex.Pattern;

/**
 * Turns model output into plain text fit for a mail body.
 * Markdown marks are dropped, line structure is kept, HTML replies are flattened to text first.
 */
public final class TextFormatter {
    private static final Pattern HTML_TAG = Pattern.compile("<(/?[a-zA-Z][a-zA-Z0-9]*)(\\s[^>]*)?/?>");
    private static final Pattern MD_LINE_MARKS = Pattern.compile("(?m)^[ \\t]*(#{1,6}[ \\t]+|>[ \\t]?|`{3}[^\\n]*$)");
    private static final Pattern MD_INLINE_MARKS = Pattern.compile("(\\*\\*|__|`)");
    private static final Pattern MULTI_BLANK = Pattern.compile("\n{3,}");
    private static final Pattern TRAILING_SPACE = Pattern.compile("[ \\t]+\n");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cntrl}&&[^\n\t]]");

    private TextFormatter() {
    }

    public static String cleanSummary(String s) {
        if (s == null) {
            return "";
        }
        String t = s.replace("\r\n", "\n").replace("\r", "\n");
        if (HTML_TAG.matcher(t).find()) {
            t = htmlToText(t);
        }
        t = MD_LINE_MARKS.matcher(t).replaceAll("");
        t = MD_INLINE_MARKS.matcher(t).replaceAll("");
        t = CONTROL_CHARS.matcher(t).replaceAll("");
        t = TRAILING_SPACE.matcher(t).replaceAll("\n");
        t = MULTI_BLANK.matcher(t).replaceAll("\n\n");
        return t.trim();
    }

    // Block elements become line breaks; jsoup's text() would otherwise join everything on one line.
    static String htmlToText(String html) {
        Document doc = Jsoup.parse(html.replace("\n", "\\n"));
        doc.outputSettings().prettyPrint(false);
        doc.select("br").append("\\n");
        doc.select("p,div,li,ul,ol,h1,h2,h3,h4,h5,h6").prepend("\\n");
        return doc.text().replace("\\n", "\n");
    }
}
