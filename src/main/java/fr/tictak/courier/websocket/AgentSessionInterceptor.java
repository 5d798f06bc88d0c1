package fr.tictak.courier.websocket;

import fr.tictak.courier.security.JwtUtils;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Tags a STOMP session with the agent it belongs to when CONNECT carries a valid bearer token.
 * Sessions without a token, or with an invalid one, are still accepted as anonymous observers.
 */
@Component
public class AgentSessionInterceptor implements ChannelInterceptor {
    private static final Logger log = LoggerFactory.getLogger(AgentSessionInterceptor.class);

    public static final String AGENT_ID_ATTRIBUTE = "agentId";

    private final JwtUtils jwtUtils;

    public AgentSessionInterceptor(JwtUtils jwtUtils) {
        this.jwtUtils = jwtUtils;
    }

    @Override
    public Message<?> preSend(@NotNull Message<?> message, @NotNull MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null || !StompCommand.CONNECT.equals(accessor.getCommand())) {
            return message;
        }

        String token = jwtUtils.stripBearer(accessor.getFirstNativeHeader(JwtUtils.HEADER_AUTH));
        if (token == null) {
            log.debug("No Authorization header in CONNECT for session {}", accessor.getSessionId());
            return message;
        }
        if (!jwtUtils.validateToken(token)) {
            log.warn("Invalid token in CONNECT for session {}, continuing as anonymous", accessor.getSessionId());
            return message;
        }

        String agentId = jwtUtils.getAgentIdFromToken(token);
        Map<String, Object> sessionAttributes = accessor.getSessionAttributes();
        if (sessionAttributes != null) {
            sessionAttributes.put(AGENT_ID_ATTRIBUTE, agentId);
        }
        accessor.setUser(new UsernamePasswordAuthenticationToken(
                agentId, null, List.of(new SimpleGrantedAuthority(JwtUtils.AGENT_ROLE))));
        log.debug("Session {} authenticated as agent {}", accessor.getSessionId(), agentId);
        return message;
    }
}
