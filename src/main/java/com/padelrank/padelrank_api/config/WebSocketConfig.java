package com.padelrank.padelrank_api.config;

import com.padelrank.padelrank_api.security.JwtUtil;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;
import org.springframework.web.socket.server.support.DefaultHandshakeHandler;

import java.security.Principal;
import java.util.Map;

@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    private final JwtUtil jwtUtil;

    public WebSocketConfig(JwtUtil jwtUtil) {
        this.jwtUtil = jwtUtil;
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws-padelrank")
                .setAllowedOriginPatterns("*")
                .setHandshakeHandler(new PlayerHandshakeHandler(jwtUtil));
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/queue");
        registry.setApplicationDestinationPrefixes("/app");
        registry.setUserDestinationPrefix("/user");
    }

    /**
     * JWT-only connection mode:
     *
     *   ws://.../ws-padelrank?token=eyJhbG...
     *
     * The Principal name is the player id, which is what notifications are addressed to.
     */
    private static class PlayerHandshakeHandler extends DefaultHandshakeHandler {

        private final JwtUtil jwtUtil;

        PlayerHandshakeHandler(JwtUtil jwtUtil) {
            this.jwtUtil = jwtUtil;
        }

        @Override
        protected Principal determineUser(ServerHttpRequest request,
                                          WebSocketHandler wsHandler,
                                          Map<String, Object> attributes) {
            if (request instanceof ServletServerHttpRequest servletRequest) {
                String token = servletRequest.getServletRequest().getParameter("token");
                if (token != null) {
                    Long playerId = jwtUtil.extractPlayerId(token);
                    if (playerId != null) {
                        String name = playerId.toString();
                        return () -> name;
                    }
                }
            }
            return null; // Reject connection: no valid JWT provided
        }
    }
}
