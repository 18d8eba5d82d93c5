package com.trenddigest.core;

/**
 * Terminal verdict of one run: either delivered, or aborted at a named stage.
 */
public record PipelineResult(boolean delivered, Stage abortedAt, String reason) {
    public PipelineResult {
        reason = reason == null ? "" : reason;
        if (delivered && abortedAt != null) {
            throw new IllegalArgumentException("a delivered run has no aborting stage");
        }
        if (!delivered && abortedAt == null) {
            throw new IllegalArgumentException("an aborted run must name its stage");
        }
    }

    public static PipelineResult deliveredResult() {
        return new PipelineResult(true, null, "");
    }

    public static PipelineResult aborted(Stage stage, String reason) {
        return new PipelineResult(false, stage, reason);
    }

    public int exitCode() {
        return delivered ? 0 : 1;
    }

    @Override
    public String toString() {
        return delivered ? "Delivered" : "Aborted(\"" + abortedAt.label() + "\", " + reason + ")";
    }
}
