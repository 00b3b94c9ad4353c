package com.nicolaswinsten.semantle.web;

import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

import com.nicolaswinsten.semantle.config.SemantleProperties;

/**
 * Configures the STOMP-over-WebSocket channel for real-time guessing.
 *
 * <h3>Key destinations</h3>
 * <table>
 *   <tr><th>Destination</th><th>Direction</th><th>Purpose</th></tr>
 *   <tr><td>{@code /app/guess}</td><td>client → server</td><td>submit a guess</td></tr>
 *   <tr><td>{@code /topic/game/{sessionId}/attempts}</td><td>server → clients</td><td>scored guesses</td></tr>
 *   <tr><td>{@code /topic/game/{sessionId}/errors}</td><td>server → clients</td><td>rejected guesses</td></tr>
 *   <tr><td>{@code /topic/game/{sessionId}/status}</td><td>server → clients</td><td>game completed</td></tr>
 * </table>
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    private final SemantleProperties properties;

    public WebSocketConfig(SemantleProperties properties) {
        this.properties = properties;
    }

    /**
     * Enable an in-memory STOMP broker on {@code /topic} and route
     * client-sent messages prefixed with {@code /app} to controller methods.
     */
    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic");
        registry.setApplicationDestinationPrefixes("/app");
    }

    /**
     * Expose {@code /ws} as the WebSocket/SockJS handshake endpoint.
     */
    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
            .setAllowedOriginPatterns(properties.getWeb().getAllowedOrigins().toArray(String[]::new))
            .withSockJS();
    }
}
