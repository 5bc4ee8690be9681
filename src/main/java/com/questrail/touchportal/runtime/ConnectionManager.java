package com.questrail.touchportal.runtime;

import com.questrail.touchportal.api.ConnectionState;
import com.questrail.touchportal.api.DisconnectReason;
import com.questrail.touchportal.observability.ConnectionTransitionEvent;
import com.questrail.touchportal.observability.ErrorCategory;
import com.questrail.touchportal.observability.NullObservabilitySink;
import com.questrail.touchportal.observability.PluginErrorEvent;
import com.questrail.touchportal.observability.PluginObservabilitySink;
import com.questrail.touchportal.protocol.JsonLineCodec;
import com.questrail.touchportal.protocol.LineFramer;
import com.questrail.touchportal.protocol.OutboundMessage;
import com.questrail.touchportal.transport.StreamEndpoint;
import com.questrail.touchportal.transport.StreamEndpointListener;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * ConnectionManager
 * =============================================================================
 * Owns the stream to the controller and runs the connection loop.
 *
 * <h2>State machine</h2>
 * <pre>
 *   DISCONNECTED → CONNECTING → CONNECTED → DISCONNECTED
 *                      │                        ▲
 *                      └──── open failed ───────┘
 * </pre>
 *
 * <h2>Threading Model</h2>
 * {@link #connect()} runs the loop on the calling thread and returns only when
 * the loop exits. Transport callbacks never touch protocol state; they enqueue
 * signals which the loop drains with a bounded wait of {@code pollInterval}.
 * Framing and the hand-off of each complete line to the {@link Listener}
 * happen serially on the loop thread, in arrival order.
 *
 * <p>{@link #send(OutboundMessage)} and {@link #disconnect()} may be called from
 * any thread. Writes are serialized by a single lock so lines never interleave.</p>
 *
 * <h2>Termination</h2>
 * The loop ends on {@link #disconnect()}, on peer close, or on a transport
 * failure. In every case the endpoint is closed, the state returns to
 * {@code DISCONNECTED} and {@link Listener#onTerminated} is called exactly once
 * before {@code connect()} returns.
 *
 * <p>Any exception thrown while opening the stream ends the attempt with
 * {@code CONNECT_FAILED}. A {@code disconnect()} that arrives while connecting
 * belongs to that attempt and ends it with {@code REQUESTED} once the stream
 * is open; it is never carried over to a later {@code connect()}.</p>
 */
public final class ConnectionManager
{
    /**
     * Receives what the loop produces. Called on the loop thread.
     */
    public interface Listener
    {
        void onLine(String line);

        /**
         * @param cause the transport failure, if any
         */
        void onTerminated(DisconnectReason reason, Throwable cause);
    }

    private sealed interface InboundSignal permits Bytes, Closed, Wake {}

    private record Bytes(byte[] chunk) implements InboundSignal {}

    private record Closed(Throwable cause) implements InboundSignal {}

    private record Wake() implements InboundSignal {}

    private record Termination(DisconnectReason reason, Throwable cause) {}

    /**
     * One {@code connect()} call. Installed atomically, so a stop request can
     * never land on a previous or a following connection.
     */
    private static final class Attempt
    {
        private final AtomicBoolean stopRequested = new AtomicBoolean(false);
        private volatile ConnectionState state = ConnectionState.CONNECTING;
    }

    private final String pluginId;
    private final StreamEndpoint endpoint;
    private final JsonLineCodec codec;
    private final Duration pollInterval;
    private final PluginObservabilitySink sink;

    private final BlockingQueue<InboundSignal> signals = new LinkedBlockingQueue<>();
    private final AtomicReference<Attempt> current = new AtomicReference<>();
    private final Object writeLock = new Object();
    private final LineFramer framer = new LineFramer();

    private volatile Listener listener;

    public ConnectionManager(String pluginId,
                             StreamEndpoint endpoint,
                             JsonLineCodec codec,
                             Duration pollInterval,
                             PluginObservabilitySink sink)
    {
        this.pluginId = Objects.requireNonNull(pluginId, "pluginId");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.sink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);

        endpoint.setListener(new StreamEndpointListener() {
            @Override
            public void onBytes(byte[] chunk) {
                signals.offer(new Bytes(chunk));
            }

            @Override
            public void onClosed(Throwable cause) {
                signals.offer(new Closed(cause));
            }
        });
    }

    /**
     * Must be called before {@link #connect()}.
     */
    public void setListener(Listener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    public ConnectionState state() {
        Attempt a = current.get();
        return a == null ? ConnectionState.DISCONNECTED : a.state;
    }

    public boolean isConnected() {
        return state() == ConnectionState.CONNECTED;
    }

    /**
     * Opens the stream, sends the pairing message and runs the loop until it
     * ends. Blocks the calling thread for the lifetime of the connection.
     *
     * @return why the loop ended; {@link DisconnectReason#ALREADY_CONNECTED}
     *         without side effects if a connection is already active
     */
    public DisconnectReason connect() {
        Listener l = listener;
        if (l == null) {
            throw new IllegalStateException("Listener must be set before connect()");
        }
        Attempt attempt = new Attempt();
        if (!current.compareAndSet(null, attempt)) {
            return DisconnectReason.ALREADY_CONNECTED;
        }
        signals.clear();
        framer.reset();
        emitTransition(ConnectionState.DISCONNECTED, ConnectionState.CONNECTING);

        try {
            endpoint.open();
        } catch (IOException | RuntimeException e) {
            endpoint.close();
            signals.clear();
            attempt.state = ConnectionState.DISCONNECTED;
            current.compareAndSet(attempt, null);
            emitTransition(ConnectionState.CONNECTING, ConnectionState.DISCONNECTED);
            l.onTerminated(DisconnectReason.CONNECT_FAILED, e);
            return DisconnectReason.CONNECT_FAILED;
        }

        Termination termination = new Termination(DisconnectReason.REQUESTED, null);
        try {
            attempt.state = ConnectionState.CONNECTED;
            emitTransition(ConnectionState.CONNECTING, ConnectionState.CONNECTED);
            if (!attempt.stopRequested.get()) {
                send(OutboundMessage.pair(pluginId));
            }
            termination = runLoop(attempt, l);
        } finally {
            attempt.stopRequested.set(true);
            endpoint.close();
            signals.clear();
            framer.reset();
            attempt.state = ConnectionState.DISCONNECTED;
            current.compareAndSet(attempt, null);
            emitTransition(ConnectionState.CONNECTED, ConnectionState.DISCONNECTED);
            l.onTerminated(termination.reason(), termination.cause());
        }
        return termination.reason();
    }

    /**
     * Asks the loop to stop and closes the stream. Idempotent; a no-op when
     * not connected. Safe to call from handlers, and while connecting.
     */
    public void disconnect() {
        Attempt a = current.get();
        if (a == null) {
            return;
        }
        if (a.stopRequested.compareAndSet(false, true)) {
            endpoint.close();
            signals.offer(new Wake());
        }
    }

    /**
     * Writes one message as a JSON line.
     *
     * @return {@code false} if the message was dropped because the connection
     *         is not established or the stream cannot take more data; the
     *         latter is also reported as a {@code TRANSPORT} error event
     */
    public boolean send(OutboundMessage message) {
        Objects.requireNonNull(message, "message");
        byte[] line = codec.encode(message);
        String text = new String(line, 0, line.length - 1, StandardCharsets.UTF_8);
        boolean written;
        synchronized (writeLock) {
            if (!isConnected()) {
                return false;
            }
            written = endpoint.write(line);
        }
        if (!written) {
            sink.onError(PluginErrorEvent.of(ErrorCategory.TRANSPORT,
                    "Stream not writable, " + message.type() + " dropped", null, text));
            return false;
        }
        sink.onOutbound(text);
        return true;
    }

    private Termination runLoop(Attempt attempt, Listener l) {
        while (true) {
            if (attempt.stopRequested.get()) {
                return new Termination(DisconnectReason.REQUESTED, null);
            }

            final InboundSignal signal;
            try {
                signal = signals.poll(pollInterval.toNanos(), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new Termination(DisconnectReason.REQUESTED, null);
            }

            if (signal instanceof Closed closed) {
                if (attempt.stopRequested.get()) {
                    return new Termination(DisconnectReason.REQUESTED, null);
                }
                return closed.cause() == null
                        ? new Termination(DisconnectReason.PEER_CLOSED, null)
                        : new Termination(DisconnectReason.TRANSPORT_ERROR, closed.cause());
            }
            if (signal instanceof Bytes bytes) {
                deliver(bytes.chunk(), attempt, l);
            }
        }
    }

    private void deliver(byte[] chunk, Attempt attempt, Listener l) {
        for (String line : framer.append(chunk)) {
            if (attempt.stopRequested.get()) {
                return;
            }
            if (line.isBlank()) {
                continue;
            }
            sink.onInbound(line);
            try {
                l.onLine(line);
            } catch (RuntimeException e) {
                sink.onError(PluginErrorEvent.of(ErrorCategory.PROTOCOL, "Line processing failed", e, line));
            }
        }
    }

    private void emitTransition(ConnectionState from, ConnectionState to) {
        sink.onConnectionTransition(new ConnectionTransitionEvent(Instant.now(), from, to));
    }
}
