package com.trenddigest.pipeline;

import com.trenddigest.core.PipelineResult;
import com.trenddigest.core.Stage;
import com.trenddigest.core.StageException;
import com.trenddigest.data.TopicSource;
import com.trenddigest.model.TopicBatch;
import com.trenddigest.output.AuditSink;
import com.trenddigest.output.Notifier;
import com.trenddigest.summary.Summarizer;
import com.trenddigest.utils.StepTimer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * Runs fetch → summarize → deliver once, stopping at the first stage without a usable result.
 * Stages retry internally; nothing is retried here.
 */
public final class DigestPipeline {
    private static final Logger LOG = LogManager.getLogger(DigestPipeline.class);

    public enum State {
        IDLE,
        FETCHED,
        SUMMARIZED,
        DELIVERED,
        ABORTED
    }

    private final TopicSource source;
    private final Summarizer summarizer;
    private final Notifier notifier;
    private final AuditSink audit;
    private final int limit;
    private final StepTimer timer = new StepTimer();
    private State state = State.IDLE;

    public DigestPipeline(TopicSource source, Summarizer summarizer, Notifier notifier, AuditSink audit, int limit) {
        this.source = source;
        this.summarizer = summarizer;
        this.notifier = notifier;
        this.audit = audit == null ? AuditSink.NONE : audit;
        this.limit = limit <= 0 ? TopicBatch.DEFAULT_LIMIT : limit;
    }

    public State state() {
        return state;
    }

    public StepTimer timer() {
        return timer;
    }

    /**
     * Produces exactly one verdict; a second call is rejected.
     */
    public PipelineResult run() {
        if (state != State.IDLE) {
            throw new IllegalStateException("pipeline already ran, state=" + state);
        }
        try {
            return execute();
        } finally {
            LOG.info("Pipeline finished state={} timings: {}", state, timer.summaryText());
        }
    }

    private PipelineResult execute() {
        TopicBatch batch;
        timer.start(Stage.FETCH.label());
        try {
            batch = source.fetch(limit);
        } catch (StageException | RuntimeException e) {
            return abort(Stage.FETCH, e);
        } finally {
            timer.end(Stage.FETCH.label());
        }
        if (batch == null || batch.isEmpty()) {
            return abort(Stage.FETCH, "provider returned no topics");
        }
        transition(State.FETCHED, batch.size() + " topics");
        try {
            audit.recordTopics(batch);
        } catch (IOException e) {
            LOG.warn("Failed to save raw topics: {}", e.getMessage());
        }

        String summary;
        timer.start(Stage.SUMMARIZE.label());
        try {
            summary = summarizer.summarize(batch);
        } catch (StageException | RuntimeException e) {
            return abort(Stage.SUMMARIZE, e);
        } finally {
            timer.end(Stage.SUMMARIZE.label());
        }
        if (summary == null || summary.isBlank()) {
            return abort(Stage.SUMMARIZE, "summarizer returned no text");
        }
        transition(State.SUMMARIZED, summary.length() + " chars");
        try {
            audit.recordSummary(summary, batch);
        } catch (IOException e) {
            LOG.warn("Failed to save summary: {}", e.getMessage());
        }

        timer.start(Stage.DELIVER.label());
        try {
            notifier.deliver(summary, batch);
        } catch (StageException | RuntimeException e) {
            return abort(Stage.DELIVER, e);
        } finally {
            timer.end(Stage.DELIVER.label());
        }
        transition(State.DELIVERED, "");
        return PipelineResult.deliveredResult();
    }

    private void transition(State next, String detail) {
        LOG.info("Pipeline {} -> {}{}", state, next, detail.isEmpty() ? "" : " (" + detail + ")");
        state = next;
    }

    private PipelineResult abort(Stage stage, Exception error) {
        String reason = error.getMessage() == null || error.getMessage().isBlank()
                ? error.getClass().getSimpleName()
                : error.getMessage();
        if (error instanceof RuntimeException) {
            LOG.error("Unexpected error in stage {}", stage.label(), error);
        }
        return abort(stage, reason);
    }

    private PipelineResult abort(Stage stage, String reason) {
        LOG.error("Pipeline aborted at stage={}: {}", stage.label(), reason);
        state = State.ABORTED;
        return PipelineResult.aborted(stage, reason);
    }
}
