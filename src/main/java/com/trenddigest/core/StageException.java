package com.trenddigest.core;

/**
 * Fatal, non-retryable failure of one stage. Retryable failures never leave the stage that saw them.
 */
public class StageException extends Exception {
    private final Stage stage;

    public StageException(Stage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public StageException(Stage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public Stage stage() {
        return stage;
    }
}
