package com.gridmaker.broker;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Transport seam for {@link MarketDataFeed}.
 */
public interface WebSocketConnector {

    CompletableFuture<Connection> connect(URI uri, FrameHandler handler);

    /** An open socket. */
    interface Connection {
        void sendText(String message);

        void sendPing();

        void close();
    }

    /** Callbacks for one connection; whole text messages only. */
    interface FrameHandler {
        void onText(String message);

        void onPong();

        void onClosed(int statusCode, String reason);

        void onError(Throwable error);
    }
}
