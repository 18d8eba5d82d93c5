package com.trenddigest.output;

/**
 * Subject and both bodies of one digest mail.
 */
public record RenderedDigest(String subject, String htmlBody, String textBody, int rowCount) {
}
