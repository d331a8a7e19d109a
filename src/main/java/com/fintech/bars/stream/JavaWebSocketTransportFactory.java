package com.fintech.bars.stream;

import org.java_websocket.client.WebSocketClient;
import org.java_websocket.handshake.ServerHandshake;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Opens feed connections with the Java-WebSocket client.
 * Sends the browser-like Origin and User-Agent headers the feed expects and
 * relies on the library's ping-based connection-lost detection.
 */
public class JavaWebSocketTransportFactory implements QuoteTransportFactory {

    private static final Logger log = LoggerFactory.getLogger(JavaWebSocketTransportFactory.class);

    private final URI uri;
    private final Map<String, String> headers;
    private final long connectTimeoutMs;
    private final int connectionLostTimeoutSeconds;

    public JavaWebSocketTransportFactory(
            URI uri,
            String origin,
            String userAgent,
            long connectTimeoutMs,
            int connectionLostTimeoutSeconds) {
        this.uri = uri;
        this.connectTimeoutMs = connectTimeoutMs;
        this.connectionLostTimeoutSeconds = connectionLostTimeoutSeconds;

        Map<String, String> h = new LinkedHashMap<>();
        if (origin != null && !origin.isBlank()) {
            h.put("Origin", origin);
        }
        if (userAgent != null && !userAgent.isBlank()) {
            h.put("User-Agent", userAgent);
        }
        this.headers = Map.copyOf(h);
    }

    @Override
    public QuoteTransport open(TransportListener listener) throws InterruptedException {
        FeedWebSocket socket = new FeedWebSocket(uri, headers, listener);
        socket.setConnectionLostTimeout(connectionLostTimeoutSeconds);

        log.debug("Opening feed connection to {}", uri);
        boolean connected;
        try {
            connected = socket.connectBlocking(connectTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            socket.abandon();
            throw e;
        }
        if (!connected) {
            socket.abandon();
            throw new TransportException(
                "Could not connect to " + uri + " within " + connectTimeoutMs + "ms"
            );
        }
        return socket;
    }

    /**
     * WebSocket client forwarding library callbacks to a {@link TransportListener}.
     * An abandoned socket forwards nothing and closes itself if the handshake
     * completes after the caller gave up on it.
     */
    static final class FeedWebSocket extends WebSocketClient implements QuoteTransport {

        private final TransportListener listener;
        private volatile boolean abandoned;

        FeedWebSocket(URI serverUri, Map<String, String> headers, TransportListener listener) {
            super(serverUri, headers);
            this.listener = listener;
        }

        void abandon() {
            abandoned = true;
            close();
        }

        @Override
        public void onOpen(ServerHandshake handshake) {
            if (abandoned) {
                log.debug("Closing feed connection opened after connect was abandoned");
                close();
                return;
            }
            log.info("Feed connection open: status={}", handshake.getHttpStatus());
        }

        @Override
        public void onMessage(String message) {
            if (!abandoned) {
                listener.onText(message);
            }
        }

        @Override
        public void onClose(int code, String reason, boolean remote) {
            log.debug("Feed connection closed: code={}, reason={}, remote={}", code, reason, remote);
            if (!abandoned) {
                listener.onClose(code, reason);
            }
        }

        @Override
        public void onError(Exception ex) {
            log.debug("Feed connection error: {}", ex.getMessage());
            if (!abandoned) {
                listener.onError(ex);
            }
        }
    }
}
