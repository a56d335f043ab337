package com.nfttrader.backend.service.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fan-out point for trading lifecycle events. Listener beans are registered at startup;
 * hosts and tests can add more through {@link #subscribe}.
 */
@Component
public class TradingEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(TradingEventPublisher.class);

    private final List<TradingEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;

    @Autowired
    public TradingEventPublisher(List<TradingEventListener> initialListeners, Clock clock) {
        this.clock = clock;
        if (initialListeners != null) {
            this.listeners.addAll(initialListeners);
        }
    }

    public TradingEventPublisher(Clock clock) {
        this(Collections.emptyList(), clock);
    }

    /**
     * Registers a listener and returns a handle that removes it again.
     */
    public Runnable subscribe(TradingEventListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void publish(TradingEventType type, String ownerAddress, Map<String, Object> payload) {
        TradingEvent event = TradingEvent.builder()
            .type(type)
            .ownerAddress(ownerAddress)
            .timestamp(clock.instant())
            .payload(payload != null ? payload : Collections.emptyMap())
            .build();
        publish(event);
    }

    public void publish(TradingEvent event) {
        logger.debug("Publishing {} for {}", event.getType().getValue(), event.getOwnerAddress());
        for (TradingEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                logger.error("Listener {} failed on {}: {}", listener.getClass().getSimpleName(),
                    event.getType().getValue(), e.getMessage(), e);
            }
        }
    }

    public int getListenerCount() {
        return listeners.size();
    }
}
