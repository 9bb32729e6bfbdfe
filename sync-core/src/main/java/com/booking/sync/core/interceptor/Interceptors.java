package com.booking.sync.core.interceptor;

import com.booking.sync.core.args.ProgressArgs;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One handler per event type. Registering a handler for a type that already has one replaces it.
 * Handlers run inline on the calling thread and may throw to abort the current operation.
 */
public class Interceptors {
    private static final Logger LOG = LogManager.getLogger(Interceptors.class);

    private final Map<Class<? extends ProgressArgs>, InterceptorHandler<? extends ProgressArgs>> handlers;

    public Interceptors() {
        this.handlers = new ConcurrentHashMap<>();
    }

    public <T extends ProgressArgs> void on(Class<T> type, InterceptorHandler<T> handler) {
        if (this.handlers.put(type, handler) != null) {
            Interceptors.LOG.debug(String.format("replaced interceptor for %s", type.getSimpleName()));
        }
    }

    public void remove(Class<? extends ProgressArgs> type) {
        this.handlers.remove(type);
    }

    public boolean has(Class<? extends ProgressArgs> type) {
        return this.handlers.containsKey(type);
    }

    /**
     * Dispatches the event to its handler, if any. A pending interrupt on the calling thread cancels the operation.
     */
    @SuppressWarnings("unchecked")
    public <T extends ProgressArgs> void intercept(T args) throws Exception {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException(String.format("Interrupted before %s", args.getClass().getSimpleName()));
        }

        InterceptorHandler<T> handler = (InterceptorHandler<T>) this.handlers.get(args.getClass());

        if (handler != null) {
            handler.handle(args);
        }
    }
}
