package com.bko.plansolve.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

public class WebSocketTransport implements Transport {
    private static final Logger log = LoggerFactory.getLogger(WebSocketTransport.class);
    private static final byte[] PING_PAYLOAD = "plansolve".getBytes(StandardCharsets.US_ASCII);

    private final WebSocketSession session;

    public WebSocketTransport(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public void send(byte[] payload) throws IOException {
        synchronized (session) {
            session.sendMessage(new TextMessage(payload));
        }
    }

    @Override
    public void ping() throws IOException {
        synchronized (session) {
            session.sendMessage(new PingMessage(ByteBuffer.wrap(PING_PAYLOAD)));
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close(String reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.GOING_AWAY.withReason(reason));
        } catch (IOException ex) {
            log.debug("Failed to close websocket {}: {}", session.getId(), ex.getMessage());
        }
    }
}
