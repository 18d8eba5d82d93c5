package com.trenddigest.utils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wall-clock duration per named step, in first-start order.
 */
public class StepTimer {
    private final Map<String, Long> startNanos = new LinkedHashMap<>();
    private final Map<String, Long> durMs = new LinkedHashMap<>();

    public void start(String step) {
        startNanos.put(step, System.nanoTime());
    }

    public void end(String step) {
        Long s = startNanos.get(step);
        if (s != null) {
            durMs.put(step, Math.max(0L, (System.nanoTime() - s) / 1_000_000L));
        }
    }

    public Map<String, Long> snapshot() {
        return new LinkedHashMap<>(durMs);
    }

    public String summaryText() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Long> e : durMs.entrySet()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(e.getKey()).append('=').append(e.getValue()).append("ms");
        }
        return sb.toString();
    }
}
