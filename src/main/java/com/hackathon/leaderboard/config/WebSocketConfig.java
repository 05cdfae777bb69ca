package com.hackathon.leaderboard.config;

import com.hackathon.leaderboard.websocket.LeaderboardWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final LeaderboardWebSocketHandler leaderboardWebSocketHandler;
    private final String[] allowedOrigins;

    public WebSocketConfig(
            LeaderboardWebSocketHandler leaderboardWebSocketHandler,
            @Value("${leaderboard.websocket.allowed-origins:*}") String[] allowedOrigins) {
        this.leaderboardWebSocketHandler = leaderboardWebSocketHandler;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // /ws/hackathons is the route older clients still connect to
        registry.addHandler(leaderboardWebSocketHandler, "/ws/competitions/*", "/ws/hackathons/*")
            .setAllowedOrigins(allowedOrigins);
    }
}
