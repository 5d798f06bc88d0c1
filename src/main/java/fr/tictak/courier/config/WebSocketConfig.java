package fr.tictak.courier.config;

import fr.tictak.courier.websocket.AgentSessionInterceptor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketTransportRegistration;

/**
 * STOMP over WebSocket. Clients connect on {@code /ws}, send to {@code /app/...} and listen on
 * {@code /topic/...}.
 * <p>
 * Slow consumers are bounded by the transport: a session whose pending outbound data exceeds the
 * buffer limit, or whose single send blocks past the time limit, is closed.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    public static final String ENDPOINT = "/ws";
    public static final String TOPIC_PREFIX = "/topic";
    public static final String APP_PREFIX = "/app";

    private final AgentSessionInterceptor agentSessionInterceptor;

    @Value("${courier.websocket.allowed-origins:*}")
    private String[] allowedOrigins;

    @Value("${courier.websocket.send-time-limit-ms:10000}")
    private int sendTimeLimitMs;

    @Value("${courier.websocket.send-buffer-size-limit-bytes:524288}")
    private int sendBufferSizeLimit;

    @Value("${courier.websocket.message-size-limit-bytes:65536}")
    private int messageSizeLimit;

    @Value("${courier.websocket.outbound-pool-size:8}")
    private int outboundPoolSize;

    public WebSocketConfig(AgentSessionInterceptor agentSessionInterceptor) {
        this.agentSessionInterceptor = agentSessionInterceptor;
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint(ENDPOINT).setAllowedOriginPatterns(allowedOrigins);
        registry.setPreserveReceiveOrder(true);
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker(TOPIC_PREFIX);
        registry.setApplicationDestinationPrefixes(APP_PREFIX);
    }

    @Override
    public void configureClientInboundChannel(ChannelRegistration registration) {
        registration.interceptors(agentSessionInterceptor);
    }

    @Override
    public void configureClientOutboundChannel(ChannelRegistration registration) {
        registration.taskExecutor()
                .corePoolSize(outboundPoolSize)
                .maxPoolSize(outboundPoolSize);
    }

    @Override
    public void configureWebSocketTransport(WebSocketTransportRegistration registration) {
        registration.setSendTimeLimit(sendTimeLimitMs)
                .setSendBufferSizeLimit(sendBufferSizeLimit)
                .setMessageSizeLimit(messageSizeLimit);
    }
}
