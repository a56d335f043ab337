package com.nfttrader.backend.dto;

import com.nfttrader.backend.service.events.TradingEvent;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Payload pushed to STOMP subscribers for every trading event.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TradingEventMessage {
    private String type;
    private String ownerAddress;
    private Instant timestamp;
    private Map<String, Object> payload;

    public static TradingEventMessage from(TradingEvent event) {
        return new TradingEventMessage(
            event.getType().getValue(),
            event.getOwnerAddress(),
            event.getTimestamp(),
            event.getPayload());
    }
}
