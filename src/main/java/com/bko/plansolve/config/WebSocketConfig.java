package com.bko.plansolve.config;

import com.bko.plansolve.connection.PlanSolveWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final PlanSolveWebSocketHandler webSocketHandler;
    private final PlanSolveProperties properties;

    public WebSocketConfig(PlanSolveWebSocketHandler webSocketHandler, PlanSolveProperties properties) {
        this.webSocketHandler = webSocketHandler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(webSocketHandler, properties.getConnection().getPath())
                .setAllowedOrigins("*");
    }
}
