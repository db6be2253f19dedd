package com.gridmaker.broker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * {@link WebSocketConnector} backed by {@code java.net.http.WebSocket}.
 */
public class JdkWebSocketConnector implements WebSocketConnector {
    private static final Logger logger = LoggerFactory.getLogger(JdkWebSocketConnector.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;

    public JdkWebSocketConnector() {
        this(HttpClient.newHttpClient());
    }

    public JdkWebSocketConnector(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public CompletableFuture<Connection> connect(URI uri, FrameHandler handler) {
        logger.info("🔌 Connecting to {}", uri);
        return httpClient.newWebSocketBuilder()
            .connectTimeout(CONNECT_TIMEOUT)
            .buildAsync(uri, new ListenerAdapter(handler))
            .thenApply(JdkConnection::new);
    }

    private record JdkConnection(WebSocket webSocket) implements Connection {
        @Override
        public void sendText(String message) {
            webSocket.sendText(message, true).join();
        }

        @Override
        public void sendPing() {
            webSocket.sendPing(ByteBuffer.allocate(0));
        }

        @Override
        public void close() {
            if (!webSocket.isOutputClosed()) {
                webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "Shutting down");
            }
            webSocket.abort();
        }
    }

    /**
     * Reassembles fragmented text frames and forwards them to the handler.
     */
    private static final class ListenerAdapter implements WebSocket.Listener {
        private final FrameHandler handler;
        private final StringBuilder messageBuffer = new StringBuilder();

        private ListenerAdapter(FrameHandler handler) {
            this.handler = handler;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            logger.info("🔓 WebSocket opened");
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            messageBuffer.append(data);

            if (last) {
                String message = messageBuffer.toString();
                messageBuffer.setLength(0);
                handler.onText(message);
            }

            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onPong(WebSocket webSocket, ByteBuffer message) {
            handler.onPong();
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onPing(WebSocket webSocket, ByteBuffer message) {
            // The JDK answers pings itself; an inbound ping still proves the link is alive
            handler.onPong();
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            logger.warn("🔒 WebSocket closed: {} - {}", statusCode, reason);
            handler.onClosed(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            logger.error("❌ WebSocket error: {}", error.getMessage());
            handler.onError(error);
        }
    }
}
