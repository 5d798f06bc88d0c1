package fr.tictak.courier.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.tictak.courier.dto.in.LocationUpdateMessage;
import fr.tictak.courier.model.LocationSample;
import fr.tictak.courier.service.LocationHistoryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;

/**
 * Relays agent positions to every connected session, then hands the sample to the location
 * history. The payload is relayed exactly as received, extra fields included, once its
 * required fields check out. The relay never waits on, or fails because of, the history store.
 */
@Slf4j
@Service
public class LocationBroadcastHub {

    public static final String LOCATION_TOPIC = "/topic/agent_location_update";

    private final SimpMessagingTemplate messagingTemplate;
    private final SessionRegistry sessionRegistry;
    private final LocationHistoryService locationHistoryService;
    private final ObjectMapper objectMapper;

    public LocationBroadcastHub(SimpMessagingTemplate messagingTemplate,
                                SessionRegistry sessionRegistry,
                                LocationHistoryService locationHistoryService,
                                ObjectMapper objectMapper) {
        this.messagingTemplate = messagingTemplate;
        this.sessionRegistry = sessionRegistry;
        this.locationHistoryService = locationHistoryService;
        this.objectMapper = objectMapper;
    }

    /**
     * @return {@code true} when the payload was relayed, {@code false} when it was dropped as malformed
     */
    public boolean publish(String sessionId, Map<String, Object> payload) {
        LocationUpdateMessage update = readUpdate(sessionId, payload);
        if (update == null || !update.isWellFormed()) {
            log.warn("Dropping malformed location update from session {}: {}", sessionId, payload);
            return false;
        }

        log.info("Location update from session {} - agent={}, order={}, lat={}, lng={}",
                sessionId, update.agentId(), update.orderId(), update.lat(), update.lng());
        messagingTemplate.convertAndSend(LOCATION_TOPIC, payload);
        log.debug("Relayed location of agent {} to {} session(s)", update.agentId(), sessionRegistry.size());

        LocationSample sample = LocationSample.of(
                update.agentId(), update.orderId(), update.lat(), update.lng(), Instant.now());
        try {
            locationHistoryService.append(sample);
        } catch (TaskRejectedException e) {
            log.error("Location history backlog full, sample of agent {} for order {} not stored",
                    update.agentId(), update.orderId(), e);
        }
        return true;
    }

    private LocationUpdateMessage readUpdate(String sessionId, Map<String, Object> payload) {
        if (payload == null) {
            return null;
        }
        try {
            return objectMapper.convertValue(payload, LocationUpdateMessage.class);
        } catch (IllegalArgumentException e) {
            log.debug("Unreadable location update from session {}: {}", sessionId, e.getMessage());
            return null;
        }
    }
}
