package com.nfttrader.backend.service.events;

import com.nfttrader.backend.dto.TradingEventMessage;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Broadcasts every trading event to connected WebSocket clients.
 */
@Component
public class StompTradingEventRelay implements TradingEventListener {

    private final SimpMessagingTemplate messagingTemplate;
    private final String destination;

    @Autowired
    public StompTradingEventRelay(SimpMessagingTemplate messagingTemplate,
                                  @Value("${nft.events.topic:/topic/nft/events}") String destination) {
        this.messagingTemplate = messagingTemplate;
        this.destination = destination;
    }

    @Override
    public void onEvent(TradingEvent event) {
        messagingTemplate.convertAndSend(destination, TradingEventMessage.from(event));
    }
}
