package com.fintech.bars.stream;

import com.fintech.bars.domain.SymbolKey;
import com.fintech.bars.protocol.FrameCodec;
import com.fintech.bars.protocol.ProtocolMessage;
import com.fintech.bars.protocol.ProtocolMethod;
import com.fintech.bars.protocol.ProtocolSession;
import com.fintech.bars.protocol.QuoteUpdate;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Client for the streaming quote feed.
 *
 * <p>Owns one transport at a time and a dedicated reader thread
 * ({@code quote-stream-reader}) that:
 * <ul>
 *   <li>echoes heartbeats,</li>
 *   <li>decodes frames and dispatches {@code qsd} updates to the subscribed {@link QuoteListener},</li>
 *   <li>reconnects with exponential backoff when the transport closes or fails, then
 *       replays every retained subscription under the new session.</li>
 * </ul>
 *
 * <p>Transport callbacks only enqueue events tagged with a connection generation; all
 * protocol handling happens on the reader thread. Events from a torn-down transport
 * carry an old generation and are ignored.
 */
public class QuoteStreamClient {

    private static final Logger log = LoggerFactory.getLogger(QuoteStreamClient.class);

    static final String READER_THREAD_NAME = "quote-stream-reader";
    private static final long POLL_TIMEOUT_MS = 250L;
    private static final long JOIN_TIMEOUT_MS = 5_000L;

    private final QuoteTransportFactory transportFactory;
    private final FrameCodec codec;
    private final ReconnectBackoff backoff;
    private final Supplier<ProtocolSession> sessionFactory;
    private final Clock clock;

    private final Map<SymbolKey, QuoteListener> subscriptions = new ConcurrentHashMap<>();
    private final BlockingQueue<InboundEvent> inbound = new LinkedBlockingQueue<>();
    private final AtomicInteger generation = new AtomicInteger();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object connectionLock = new Object();

    private volatile QuoteTransport transport;
    private volatile ProtocolSession session;
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile Thread readerThread;

    private final AtomicLong framesReceived = new AtomicLong(0);
    private final AtomicLong quotesDispatched = new AtomicLong(0);
    private final AtomicLong staleQuotesDropped = new AtomicLong(0);
    private final AtomicLong listenerErrors = new AtomicLong(0);
    private final AtomicLong reconnects = new AtomicLong(0);
    private final AtomicLong connected = new AtomicLong(0);

    public QuoteStreamClient(
            QuoteTransportFactory transportFactory,
            FrameCodec codec,
            ReconnectBackoff backoff,
            Clock clock,
            MeterRegistry meterRegistry) {
        this(transportFactory, codec, backoff, ProtocolSession::create, clock, meterRegistry);
    }

    public QuoteStreamClient(
            QuoteTransportFactory transportFactory,
            FrameCodec codec,
            ReconnectBackoff backoff,
            Supplier<ProtocolSession> sessionFactory,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.transportFactory = transportFactory;
        this.codec = codec;
        this.backoff = backoff;
        this.sessionFactory = sessionFactory;
        this.clock = clock;

        meterRegistry.gauge("quote.stream.frames.received", framesReceived);
        meterRegistry.gauge("quote.stream.quotes.dispatched", quotesDispatched);
        meterRegistry.gauge("quote.stream.quotes.stale", staleQuotesDropped);
        meterRegistry.gauge("quote.stream.listener.errors", listenerErrors);
        meterRegistry.gauge("quote.stream.reconnects", reconnects);
        meterRegistry.gauge("quote.stream.connected", connected);
    }

    // ========== Lifecycle ==========

    /**
     * Opens a transport and negotiates a fresh session: {@code quote_create_session}
     * followed by {@code quote_set_fields}. Retained subscriptions are replayed with
     * {@code quote_add_symbols}. Resets the backoff on success.
     *
     * @throws TransportException if the transport cannot be opened
     * @throws InterruptedException if interrupted during the handshake
     */
    public void connect() throws InterruptedException {
        synchronized (connectionLock) {
            teardown();
            state = ConnectionState.CONNECTING;

            int gen = generation.incrementAndGet();
            QuoteTransport opened;
            try {
                opened = transportFactory.open(new GenerationListener(gen));
            } catch (RuntimeException e) {
                state = ConnectionState.DISCONNECTED;
                throw e instanceof TransportException
                    ? e
                    : new TransportException("Failed to open feed transport", e);
            }

            ProtocolSession newSession = sessionFactory.get();
            transport = opened;
            session = newSession;

            sendMessage(ProtocolMethod.QUOTE_CREATE_SESSION, List.of(newSession.id()));
            List<Object> fieldParams = new ArrayList<>();
            fieldParams.add(newSession.id());
            fieldParams.addAll(newSession.fieldCodes());
            sendMessage(ProtocolMethod.QUOTE_SET_FIELDS, fieldParams);

            state = ConnectionState.CONNECTED;
            connected.set(1);
            backoff.reset();
            log.info("Connected to quote feed: session={}", newSession.id());

            for (SymbolKey key : subscriptions.keySet()) {
                sendMessage(ProtocolMethod.QUOTE_ADD_SYMBOLS, List.of(newSession.id(), key.toString()));
            }
            if (!subscriptions.isEmpty()) {
                log.info("Resubscribed {} symbols under session={}", subscriptions.size(), newSession.id());
            }
        }
    }

    /** Tears down the current transport. Retained subscriptions are kept. */
    public void disconnect() {
        synchronized (connectionLock) {
            teardown();
        }
    }

    /**
     * Connects (best effort) and starts the reader thread. A failed initial connect
     * is retried by the reader with backoff.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Quote stream already running");
            return;
        }

        try {
            connect();
        } catch (TransportException e) {
            log.warn("Initial feed connect failed, retrying in background: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.set(false);
            log.warn("Interrupted while starting quote stream");
            return;
        }

        Thread thread = new Thread(this::runLoop, READER_THREAD_NAME);
        thread.setDaemon(true);
        readerThread = thread;
        thread.start();
        log.info("Quote stream started");
    }

    /**
     * Stops the reader (cancelling any backoff sleep), waits for it to exit and
     * closes the transport.
     */
    public void stop() {
        boolean wasRunning = running.getAndSet(false);
        Thread thread = readerThread;
        readerThread = null;

        if (thread != null) {
            thread.interrupt();
            if (thread != Thread.currentThread()) {
                try {
                    thread.join(JOIN_TIMEOUT_MS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                if (thread.isAlive()) {
                    log.warn("Reader thread did not exit within {}ms", JOIN_TIMEOUT_MS);
                }
            }
        }

        disconnect();
        inbound.clear();
        if (wasRunning) {
            log.info("Quote stream stopped");
        }
    }

    // ========== Subscriptions ==========

    /**
     * Subscribes to quote updates for {@code exchange:symbol}.
     *
     * @return the normalized symbol key
     * @throws NotConnectedException if there is no live connection
     */
    public SymbolKey subscribe(String symbol, String exchange, QuoteListener listener) {
        if (!isConnected()) {
            throw new NotConnectedException("Quote feed is not connected");
        }
        SymbolKey key = SymbolKey.of(exchange, symbol);
        subscriptions.put(key, listener);

        ProtocolSession current = session;
        if (current != null) {
            sendMessage(ProtocolMethod.QUOTE_ADD_SYMBOLS, List.of(current.id(), key.toString()));
        }
        log.info("Subscribed to {}", key);
        return key;
    }

    /**
     * Drops the subscription for {@code exchange:symbol}. Sends
     * {@code quote_remove_symbols} only while connected; never fails.
     *
     * <p>While disconnected this is not a no-op: the local subscription is still
     * removed, so the next reconnect does not resubscribe the instrument.
     *
     * @return true if a subscription was removed
     */
    public boolean unsubscribe(String symbol, String exchange) {
        SymbolKey key = SymbolKey.of(exchange, symbol);
        QuoteListener removed = subscriptions.remove(key);
        if (removed == null) {
            return false;
        }

        ProtocolSession current = session;
        if (isConnected() && current != null) {
            sendMessage(ProtocolMethod.QUOTE_REMOVE_SYMBOLS, List.of(current.id(), key.toString()));
        }
        log.info("Unsubscribed from {}", key);
        return true;
    }

    // ========== State ==========

    public boolean isConnected() {
        QuoteTransport t = transport;
        return state == ConnectionState.CONNECTED && t != null && t.isOpen();
    }

    public boolean isRunning() {
        return running.get();
    }

    public ConnectionState getState() {
        return state;
    }

    public Optional<String> getSessionId() {
        ProtocolSession current = session;
        return current == null ? Optional.empty() : Optional.of(current.id());
    }

    public Set<SymbolKey> getSubscribedKeys() {
        return Set.copyOf(subscriptions.keySet());
    }

    public int getSubscriptionCount() {
        return subscriptions.size();
    }

    public long getReconnects() {
        return reconnects.get();
    }

    public long getStaleQuotesDropped() {
        return staleQuotesDropped.get();
    }

    public long getListenerErrors() {
        return listenerErrors.get();
    }

    // ========== Reader loop ==========

    private void runLoop() {
        log.debug("Reader thread started");
        while (running.get()) {
            try {
                if (!isConnected()) {
                    reconnect();
                    continue;
                }

                InboundEvent event = inbound.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (event == null || event.generation() != generation.get()) {
                    continue;
                }

                switch (event.kind()) {
                    case TEXT:
                        handleChunk(event.text());
                        break;
                    case CLOSED:
                        log.warn("Feed connection closed: code={}, reason={}", event.code(), event.reason());
                        disconnect();
                        break;
                    case ERROR:
                        log.warn("Feed connection error: {}", event.reason());
                        disconnect();
                        break;
                    default:
                        break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Unexpected error in quote stream reader", e);
                disconnect();
            }
        }
        log.debug("Reader thread exiting");
    }

    private void reconnect() throws InterruptedException {
        long delay = backoff.pause();
        if (!running.get()) {
            return;
        }
        reconnects.incrementAndGet();
        log.info("Reconnecting to quote feed after {}ms", delay);
        try {
            connect();
        } catch (TransportException e) {
            log.warn("Reconnect failed: {} (next attempt in {}ms)", e.getMessage(), backoff.currentDelayMs());
        }
    }

    private void handleChunk(String raw) {
        framesReceived.incrementAndGet();

        codec.findHeartbeat(raw).ifPresent(heartbeat -> {
            sendRaw(codec.encodeHeartbeat(heartbeat));
            if (log.isTraceEnabled()) {
                log.trace("Echoed heartbeat {}", heartbeat);
            }
        });

        for (ProtocolMessage message : codec.decode(raw)) {
            dispatch(message);
        }
    }

    private void dispatch(ProtocolMessage message) {
        Optional<ProtocolMethod> method = message.knownMethod();
        if (method.isEmpty()) {
            log.debug("Ignoring message with method {}", message.method());
            return;
        }

        switch (method.get()) {
            case QUOTE_DATA:
                handleQuoteData(message);
                break;
            case QUOTE_COMPLETED:
                log.debug("Quote snapshot completed: {}", message.params());
                break;
            case CRITICAL_ERROR:
                log.error("Feed reported critical error: {}", message.params());
                break;
            case PROTOCOL_ERROR:
                log.error("Feed reported protocol error: {}", message.params());
                break;
            default:
                log.debug("Ignoring outbound-only method {} received from feed", message.method());
        }
    }

    private void handleQuoteData(ProtocolMessage message) {
        if (message.paramCount() < 2) {
            return;
        }

        ProtocolSession current = session;
        String sessionId = message.param(0).asText();
        if (current == null || !current.owns(sessionId)) {
            staleQuotesDropped.incrementAndGet();
            if (log.isTraceEnabled()) {
                log.trace("Dropping quote for foreign session {}", sessionId);
            }
            return;
        }

        Optional<QuoteUpdate> decoded = QuoteUpdate.decode(message.param(1), clock.millis());
        if (decoded.isEmpty()) {
            return;
        }

        QuoteUpdate update = decoded.get();
        QuoteListener listener = subscriptions.get(update.key());
        if (listener == null) {
            return;
        }

        try {
            listener.onQuote(update);
            quotesDispatched.incrementAndGet();
        } catch (RuntimeException e) {
            listenerErrors.incrementAndGet();
            log.error("Quote listener failed for {}", update.key(), e);
        }
    }

    private void sendMessage(ProtocolMethod method, List<?> params) {
        sendRaw(codec.encode(method, params));
    }

    private void sendRaw(String frame) {
        QuoteTransport t = transport;
        if (t == null) {
            log.debug("Dropping outbound frame, no transport");
            return;
        }
        try {
            t.send(frame);
        } catch (RuntimeException e) {
            // The close/error event that follows drives the reconnect
            log.warn("Failed to send frame: {}", e.getMessage());
        }
    }

    private void teardown() {
        generation.incrementAndGet();
        QuoteTransport t = transport;
        transport = null;
        session = null;
        state = ConnectionState.DISCONNECTED;
        connected.set(0);
        if (t != null) {
            try {
                t.close();
            } catch (RuntimeException e) {
                log.debug("Error closing transport: {}", e.getMessage());
            }
        }
    }

    private enum EventKind { TEXT, CLOSED, ERROR }

    private record InboundEvent(int generation, EventKind kind, String text, int code, String reason) {
    }

    /** Enqueues transport callbacks tagged with the generation they were opened under. */
    private final class GenerationListener implements TransportListener {

        private final int gen;

        GenerationListener(int gen) {
            this.gen = gen;
        }

        @Override
        public void onText(String text) {
            inbound.offer(new InboundEvent(gen, EventKind.TEXT, text, 0, null));
        }

        @Override
        public void onClose(int code, String reason) {
            inbound.offer(new InboundEvent(gen, EventKind.CLOSED, null, code, reason));
        }

        @Override
        public void onError(Exception error) {
            inbound.offer(new InboundEvent(gen, EventKind.ERROR, null, 0, String.valueOf(error.getMessage())));
        }
    }
}
