package com.example.gateway.shared.config;

import org.slf4j.MDC;

import java.util.Map;

/**
 * Reactor schedule hook that runs each task with the MDC of the thread that scheduled it, and
 * restores the worker's own MDC afterwards.
 */
public final class MdcScheduleHook {

    public static final String KEY = "gateway-mdc";

    private MdcScheduleHook() {
    }

    public static Runnable decorate(Runnable task) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        if (captured == null || captured.isEmpty()) {
            return task;
        }
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            MDC.setContextMap(captured);
            try {
                task.run();
            } finally {
                if (previous == null) {
                    MDC.clear();
                } else {
                    MDC.setContextMap(previous);
                }
            }
        };
    }
}
