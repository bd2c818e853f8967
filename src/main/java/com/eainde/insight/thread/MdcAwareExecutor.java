package com.eainde.insight.thread;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Executor decorator that carries the submitting thread's MDC (run id and similar) onto the
 * worker thread for the duration of each task.
 */
public class MdcAwareExecutor implements Executor {

    private final Executor delegate;

    public MdcAwareExecutor(Executor delegate) {
        this.delegate = delegate;
    }

    @Override
    public void execute(Runnable command) {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            } else {
                MDC.clear();
            }
            try {
                command.run();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        });
    }
}
