package com.nfttrader.backend.service.events;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class TradingEvent {
    TradingEventType type;
    String ownerAddress;
    Instant timestamp;
    @Singular("attribute")
    Map<String, Object> payload;
}
