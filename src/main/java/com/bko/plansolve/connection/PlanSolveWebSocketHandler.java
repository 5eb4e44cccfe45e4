package com.bko.plansolve.connection;

import com.bko.plansolve.session.SessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.nio.charset.StandardCharsets;

@Component
public class PlanSolveWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(PlanSolveWebSocketHandler.class);
    static final String CONNECTION_ID_ATTRIBUTE = "connectionId";

    private final ConnectionRegistry connectionRegistry;
    private final InboundDispatcher dispatcher;
    private final SessionService sessionService;

    public PlanSolveWebSocketHandler(ConnectionRegistry connectionRegistry,
                                     InboundDispatcher dispatcher,
                                     SessionService sessionService) {
        this.connectionRegistry = connectionRegistry;
        this.dispatcher = dispatcher;
        this.sessionService = sessionService;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        ClientConnection connection = connectionRegistry.register(new WebSocketTransport(session));
        session.getAttributes().put(CONNECTION_ID_ATTRIBUTE, connection.id());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Object connectionId = session.getAttributes().get(CONNECTION_ID_ATTRIBUTE);
        connectionRegistry.find(connectionId == null ? null : connectionId.toString())
                .ifPresentOrElse(
                        connection -> dispatcher.submit(connection, message.getPayload().getBytes(StandardCharsets.UTF_8)),
                        () -> log.debug("Dropping frame from unregistered websocket {}", session.getId()));
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        Object connectionId = session.getAttributes().get(CONNECTION_ID_ATTRIBUTE);
        if (connectionId != null) {
            connectionRegistry.recordPong(connectionId.toString());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error on websocket {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        Object connectionId = session.getAttributes().get(CONNECTION_ID_ATTRIBUTE);
        if (connectionId == null) {
            return;
        }
        connectionRegistry.unregister(connectionId.toString())
                .ifPresent(sessionService::onConnectionClosed);
    }
}
