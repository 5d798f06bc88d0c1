package fr.tictak.courier.controller;

import fr.tictak.courier.dto.out.ConnectionResponse;
import fr.tictak.courier.websocket.LocationBroadcastHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.annotation.SubscribeMapping;
import org.springframework.stereotype.Controller;

import java.util.Map;

@Controller
public class LocationBroadcastController {

    private static final Logger logger = LoggerFactory.getLogger(LocationBroadcastController.class);

    private final LocationBroadcastHub locationBroadcastHub;

    public LocationBroadcastController(LocationBroadcastHub locationBroadcastHub) {
        this.locationBroadcastHub = locationBroadcastHub;
    }

    /**
     * Connection acknowledgement: subscribing to {@code /app/connection_response} answers once with
     * the session id.
     */
    @SubscribeMapping("/connection_response")
    public ConnectionResponse acknowledgeConnection(SimpMessageHeaderAccessor headerAccessor) {
        String sessionId = headerAccessor.getSessionId();
        logger.debug("Connection acknowledgement sent to session {}", sessionId);
        return ConnectionResponse.connected(sessionId);
    }

    @MessageMapping("/location_update")
    public void updateLocation(@Payload Map<String, Object> message,
                               SimpMessageHeaderAccessor headerAccessor) {
        locationBroadcastHub.publish(headerAccessor.getSessionId(), message);
    }
}
