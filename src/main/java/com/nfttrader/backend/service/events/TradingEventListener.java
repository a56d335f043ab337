package com.nfttrader.backend.service.events;

/**
 * Receives lifecycle notifications from the trading automation services.
 * Listeners run on the publishing thread and should return quickly.
 */
@FunctionalInterface
public interface TradingEventListener {

    void onEvent(TradingEvent event);
}
