package fr.tictak.courier.websocket;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.Message;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;

import static org.assertj.core.api.Assertions.assertThat;

class WebSocketEventListenerTest {

    private SessionRegistry sessionRegistry;
    private WebSocketEventListener listener;

    @BeforeEach
    void setUp() {
        sessionRegistry = new SessionRegistry();
        listener = new WebSocketEventListener(sessionRegistry);
    }

    private static Message<byte[]> frame(SimpMessageType type, String sessionId) {
        SimpMessageHeaderAccessor accessor = SimpMessageHeaderAccessor.create(type);
        accessor.setSessionId(sessionId);
        return MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());
    }

    @Test
    @DisplayName("An anonymous connection is registered without an agent")
    void connected_Anonymous() {
        listener.handleSessionConnected(new SessionConnectedEvent(this, frame(SimpMessageType.CONNECT_ACK, "s1")));

        assertThat(sessionRegistry.isConnected("s1")).isTrue();
        assertThat(sessionRegistry.find("s1")).get()
                .extracting(SessionRegistry.ConnectedSession::agentId).isNull();
    }

    @Test
    @DisplayName("An authenticated connection is registered with its agent id")
    void connected_Agent() {
        Principal agent = new UsernamePasswordAuthenticationToken("A1", null);

        listener.handleSessionConnected(
                new SessionConnectedEvent(this, frame(SimpMessageType.CONNECT_ACK, "s2"), agent));

        assertThat(sessionRegistry.find("s2")).get()
                .extracting(SessionRegistry.ConnectedSession::agentId).isEqualTo("A1");
    }

    @Test
    @DisplayName("Disconnect removes the session")
    void disconnect_Unregisters() {
        listener.handleSessionConnected(new SessionConnectedEvent(this, frame(SimpMessageType.CONNECT_ACK, "s1")));
        listener.handleSessionConnected(new SessionConnectedEvent(this, frame(SimpMessageType.CONNECT_ACK, "s2")));

        listener.handleSessionDisconnect(new SessionDisconnectEvent(
                this, frame(SimpMessageType.DISCONNECT, "s1"), "s1", CloseStatus.NORMAL));

        assertThat(sessionRegistry.isConnected("s1")).isFalse();
        assertThat(sessionRegistry.isConnected("s2")).isTrue();
        assertThat(sessionRegistry.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Disconnect of an unknown session is ignored")
    void disconnect_Unknown() {
        listener.handleSessionDisconnect(new SessionDisconnectEvent(
                this, frame(SimpMessageType.DISCONNECT, "ghost"), "ghost", CloseStatus.GOING_AWAY));

        assertThat(sessionRegistry.size()).isZero();
    }
}
