package fr.tictak.courier.websocket;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live real-time sessions, keyed by STOMP session id. Agents and observers are tracked alike;
 * {@code agentId} is only known when the session presented a valid token on CONNECT.
 */
@Slf4j
@Component
public class SessionRegistry {

    public record ConnectedSession(String sessionId, String agentId, Instant connectedAt) {
    }

    private final Map<String, ConnectedSession> sessions = new ConcurrentHashMap<>();

    public ConnectedSession register(String sessionId, String agentId) {
        ConnectedSession session = new ConnectedSession(sessionId, agentId, Instant.now());
        sessions.put(sessionId, session);
        log.info("Session connected: {} (agent={}), {} live", sessionId, agentId, sessions.size());
        return session;
    }

    public Optional<ConnectedSession> unregister(String sessionId) {
        ConnectedSession removed = sessions.remove(sessionId);
        if (removed != null) {
            log.info("Session disconnected: {} (agent={}), {} live", sessionId, removed.agentId(), sessions.size());
        }
        return Optional.ofNullable(removed);
    }

    public boolean isConnected(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public Optional<ConnectedSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public int size() {
        return sessions.size();
    }

    public Collection<ConnectedSession> snapshot() {
        return List.copyOf(sessions.values());
    }
}
