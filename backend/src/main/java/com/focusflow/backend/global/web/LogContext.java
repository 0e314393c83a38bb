package com.focusflow.backend.global.web;

import org.slf4j.MDC;

/**
 * MDC keys shared by request handling and background job ticks.
 */
public final class LogContext {

    public static final String REQUEST_ID = "requestId";
    public static final String JOB = "job";

    private LogContext() {
    }

    public static Scope open(String key, String value) {
        String previous = MDC.get(key);
        MDC.put(key, value);
        return () -> {
            if (previous == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, previous);
            }
        };
    }

    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
