package com.crosscheck.core.bus;

import com.crosscheck.core.message.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Wraps a handler so that each message id is processed at most once within a bounded window.
 * <p>
 * An id is claimed before the delegate runs and released again if the delegate throws,
 * so a redelivery after a failure is processed normally.
 */
public class IdempotentHandler implements Consumer<Message> {

    private static final Logger log = LoggerFactory.getLogger(IdempotentHandler.class);

    private final Consumer<Message> delegate;
    private final Map<String, Boolean> seen;

    public IdempotentHandler(Consumer<Message> delegate, int window) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be at least 1");
        }
        this.delegate = delegate;
        this.seen = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > window;
            }
        };
    }

    @Override
    public void accept(Message message) {
        synchronized (seen) {
            if (seen.containsKey(message.id())) {
                log.debug("Skipping duplicate delivery of {} {}", message.type().wireName(), message.id());
                return;
            }
            seen.put(message.id(), Boolean.TRUE);
        }
        try {
            delegate.accept(message);
        } catch (RuntimeException e) {
            synchronized (seen) {
                seen.remove(message.id());
            }
            throw e;
        }
    }

    int remembered() {
        synchronized (seen) {
            return seen.size();
        }
    }
}
