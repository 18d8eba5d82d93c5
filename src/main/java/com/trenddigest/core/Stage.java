package com.trenddigest.core;

/**
 * Pipeline stages in execution order.
 */
public enum Stage {
    FETCH("fetch"),
    SUMMARIZE("summarize"),
    DELIVER("deliver");

    private final String label;

    Stage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
