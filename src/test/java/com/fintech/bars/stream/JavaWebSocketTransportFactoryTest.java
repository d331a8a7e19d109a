package com.fintech.bars.stream;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JavaWebSocketTransportFactory Tests")
class JavaWebSocketTransportFactoryTest {

    private static final String WS_GUID = "258EAFA5-E914-47DA-95CA-C5AB0DC85B11";

    private ServerSocket server;
    private JavaWebSocketTransportFactory factory;
    private List<String> texts;
    private List<Integer> closes;
    private CountDownLatch textReceived;
    private TransportListener listener;

    @BeforeEach
    void setUp() throws IOException {
        server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
        server.setSoTimeout(5000);
        URI uri = URI.create("ws://127.0.0.1:" + server.getLocalPort() + "/socket");
        factory = new JavaWebSocketTransportFactory(uri, "https://example.test", "bars-test", 5000, 0);
        texts = new CopyOnWriteArrayList<>();
        closes = new CopyOnWriteArrayList<>();
        textReceived = new CountDownLatch(1);
        listener = new TransportListener() {
            @Override
            public void onText(String text) {
                texts.add(text);
                textReceived.countDown();
            }

            @Override
            public void onClose(int code, String reason) {
                closes.add(code);
            }

            @Override
            public void onError(Exception error) {
            }
        };
    }

    @AfterEach
    void tearDown() throws IOException {
        server.close();
    }

    @Test
    @DisplayName("Should forward text frames once the handshake completes")
    void testForwardsText() throws Exception {
        Thread handshake = new Thread(() -> {
            try {
                Socket peer = server.accept();
                acceptHandshake(peer);
                OutputStream out = peer.getOutputStream();
                byte[] payload = "~h~1".getBytes(StandardCharsets.UTF_8);
                out.write(0x81);
                out.write(payload.length);
                out.write(payload);
                out.flush();
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
        handshake.start();

        QuoteTransport transport = factory.open(listener);
        try {
            assertThat(textReceived.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(texts).containsExactly("~h~1");
        } finally {
            transport.close();
            handshake.join(5000);
        }
    }

    @Test
    @DisplayName("Should close the socket when the connecting thread is interrupted")
    void testInterruptedConnectClosesSocket() throws Exception {
        Thread.currentThread().interrupt();
        assertThatThrownBy(() -> factory.open(listener))
            .isInstanceOf(InterruptedException.class);

        // the connect attempt continues in the background; complete its handshake
        try (Socket peer = server.accept()) {
            acceptHandshake(peer);
            peer.setSoTimeout(5000);
            InputStream in = peer.getInputStream();

            int first;
            try {
                first = in.read();
            } catch (SocketTimeoutException e) {
                first = -2;
            }
            // 0x88 is a close frame; -1 means the connection was dropped
            assertThat(first).isIn(0x88, -1);
        }
        assertThat(texts).isEmpty();
        assertThat(closes).isEmpty();
    }

    private static void acceptHandshake(Socket peer) throws Exception {
        BufferedReader reader = new BufferedReader(
            new InputStreamReader(peer.getInputStream(), StandardCharsets.ISO_8859_1));
        String key = null;
        String line;
        while ((line = reader.readLine()) != null && !line.isEmpty()) {
            int colon = line.indexOf(':');
            if (colon > 0 && line.substring(0, colon).trim().equalsIgnoreCase("Sec-WebSocket-Key")) {
                key = line.substring(colon + 1).trim();
            }
        }
        assertThat(key).isNotNull();

        byte[] digest = MessageDigest.getInstance("SHA-1")
            .digest((key + WS_GUID).getBytes(StandardCharsets.ISO_8859_1));
        String response = "HTTP/1.1 101 Switching Protocols\r\n"
            + "Upgrade: websocket\r\n"
            + "Connection: Upgrade\r\n"
            + "Sec-WebSocket-Accept: " + Base64.getEncoder().encodeToString(digest) + "\r\n"
            + "\r\n";
        OutputStream out = peer.getOutputStream();
        out.write(response.getBytes(StandardCharsets.ISO_8859_1));
        out.flush();
    }
}
