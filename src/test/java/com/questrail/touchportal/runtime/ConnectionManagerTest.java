package com.questrail.touchportal.runtime;

import com.questrail.touchportal.api.ConnectionState;
import com.questrail.touchportal.api.DisconnectReason;
import com.questrail.touchportal.observability.ConnectionTransitionEvent;
import com.questrail.touchportal.observability.ErrorCategory;
import com.questrail.touchportal.observability.PluginErrorEvent;
import com.questrail.touchportal.observability.RecordingObservabilitySink;
import com.questrail.touchportal.protocol.JsonLineCodec;
import com.questrail.touchportal.protocol.OutboundMessage;
import com.questrail.touchportal.transport.FakeStreamEndpoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionManagerTest {

    private static final String PLUGIN_ID = "com.example.plugin";

    private record Terminated(DisconnectReason reason, Throwable cause) {}

    private final FakeStreamEndpoint endpoint = new FakeStreamEndpoint();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final List<String> lines = new CopyOnWriteArrayList<>();
    private final List<Terminated> terminations = new CopyOnWriteArrayList<>();
    private final ExecutorService loopThread = Executors.newSingleThreadExecutor();

    private ConnectionManager manager;

    @BeforeEach
    void setUp() {
        manager = new ConnectionManager(PLUGIN_ID, endpoint, new JsonLineCodec(), Duration.ofMillis(5), sink);
        manager.setListener(new ConnectionManager.Listener() {
            @Override
            public void onLine(String line) {
                lines.add(line);
            }

            @Override
            public void onTerminated(DisconnectReason reason, Throwable cause) {
                terminations.add(new Terminated(reason, cause));
            }
        });
    }

    @AfterEach
    void tearDown() {
        manager.disconnect();
        loopThread.shutdownNow();
    }

    private Future<DisconnectReason> connectInBackground() throws Exception {
        Future<DisconnectReason> result = loopThread.submit(manager::connect);
        assertTrue(endpoint.awaitOpen(2, TimeUnit.SECONDS));
        Eventually.await(() -> !sink.getOutbound().isEmpty(), "pairing message");
        return result;
    }

    @Test
    void pairingMessageIsTheFirstLineWritten() throws Exception {
        connectInBackground();

        assertEquals("{\"type\":\"pair\",\"id\":\"com.example.plugin\"}", endpoint.writtenLines().get(0));
        assertTrue(manager.isConnected());
        assertEquals(List.of("{\"type\":\"pair\",\"id\":\"com.example.plugin\"}"), sink.getOutbound());
    }

    @Test
    void linesSplitAcrossChunksAreReassembled() throws Exception {
        connectInBackground();

        endpoint.inject("{\"type\":\"act");
        endpoint.inject("ion\"}\n\n{\"type\":\"broadcast\"}\r\n");

        Eventually.await(() -> lines.size() == 2, "two lines");
        assertEquals(List.of("{\"type\":\"action\"}", "{\"type\":\"broadcast\"}"), lines);
        assertEquals(lines, sink.getInbound());
    }

    @Test
    void disconnectEndsTheLoopExactlyOnce() throws Exception {
        Future<DisconnectReason> result = connectInBackground();

        manager.disconnect();
        manager.disconnect();

        assertEquals(DisconnectReason.REQUESTED, result.get(2, TimeUnit.SECONDS));
        assertEquals(1, terminations.size());
        assertEquals(DisconnectReason.REQUESTED, terminations.get(0).reason());
        assertNull(terminations.get(0).cause());
        assertEquals(ConnectionState.DISCONNECTED, manager.state());
        assertFalse(endpoint.isOpen());
    }

    @Test
    void transitionsAreReportedInOrder() throws Exception {
        Future<DisconnectReason> result = connectInBackground();
        manager.disconnect();
        result.get(2, TimeUnit.SECONDS);

        List<ConnectionTransitionEvent> transitions = sink.getTransitions();
        assertEquals(3, transitions.size());
        assertEquals(ConnectionState.CONNECTING, transitions.get(0).newState());
        assertTrue(transitions.get(1).isEstablished());
        assertEquals(ConnectionState.CONNECTED, transitions.get(2).oldState());
        assertEquals(ConnectionState.DISCONNECTED, transitions.get(2).newState());
    }

    @Test
    void peerCloseEndsTheLoop() throws Exception {
        Future<DisconnectReason> result = connectInBackground();

        endpoint.closeFromPeer(null);

        assertEquals(DisconnectReason.PEER_CLOSED, result.get(2, TimeUnit.SECONDS));
        assertEquals(List.of(new Terminated(DisconnectReason.PEER_CLOSED, null)), terminations);
    }

    @Test
    void transportFailureCarriesItsCause() throws Exception {
        Future<DisconnectReason> result = connectInBackground();
        IOException failure = new IOException("connection reset");

        endpoint.closeFromPeer(failure);

        assertEquals(DisconnectReason.TRANSPORT_ERROR, result.get(2, TimeUnit.SECONDS));
        assertSame(failure, terminations.get(0).cause());
    }

    @Test
    void openFailureIsReportedWithoutRunningTheLoop() {
        IOException refused = new IOException("connection refused");
        endpoint.failOpenWith(refused);

        assertEquals(DisconnectReason.CONNECT_FAILED, manager.connect());

        assertEquals(List.of(new Terminated(DisconnectReason.CONNECT_FAILED, refused)), terminations);
        assertEquals(ConnectionState.DISCONNECTED, manager.state());
        assertEquals(2, sink.getTransitions().size());
        assertTrue(endpoint.writtenLines().isEmpty());
    }

    @Test
    void uncheckedOpenFailureEndsTheAttemptAndAllowsReconnect() throws Exception {
        IllegalStateException rejected = new IllegalStateException("event loop rejected the channel");
        endpoint.failOpenWith(rejected);

        assertEquals(DisconnectReason.CONNECT_FAILED, manager.connect());

        assertEquals(List.of(new Terminated(DisconnectReason.CONNECT_FAILED, rejected)), terminations);
        assertEquals(ConnectionState.DISCONNECTED, manager.state());

        endpoint.failOpenWith((RuntimeException) null);
        connectInBackground();

        assertTrue(manager.isConnected());
        assertEquals(2, endpoint.openCount());
    }

    @Test
    void disconnectWhileConnectingEndsThatAttempt() throws Exception {
        endpoint.duringOpen(manager::disconnect);

        Future<DisconnectReason> first = loopThread.submit(manager::connect);

        assertEquals(DisconnectReason.REQUESTED, first.get(2, TimeUnit.SECONDS));
        assertEquals(List.of(new Terminated(DisconnectReason.REQUESTED, null)), terminations);
        assertEquals(ConnectionState.DISCONNECTED, manager.state());
        assertTrue(endpoint.writtenLines().isEmpty());
        assertFalse(endpoint.isOpen());

        endpoint.duringOpen(() -> { });
        connectInBackground();

        assertTrue(manager.isConnected());
        assertEquals(1, terminations.size());
    }

    @Test
    void writeRefusedByTheStreamIsReported() throws Exception {
        connectInBackground();
        endpoint.refuseWrites(true);

        assertFalse(manager.send(OutboundMessage.stateUpdate("a.b", "1")));

        List<PluginErrorEvent> errors = sink.getErrors(ErrorCategory.TRANSPORT);
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).rawLine().contains("\"stateUpdate\""));
        assertEquals(1, sink.getOutbound().size());
        assertTrue(manager.isConnected());
    }

    @Test
    void secondConnectWhileConnectedHasNoEffect() throws Exception {
        connectInBackground();

        assertEquals(DisconnectReason.ALREADY_CONNECTED, manager.connect());
        assertEquals(1, endpoint.openCount());
        assertTrue(terminations.isEmpty());
    }

    @Test
    void sendWhileDisconnectedIsDropped() {
        assertFalse(manager.send(OutboundMessage.stateUpdate("a.b", "1")));

        assertTrue(endpoint.writtenLines().isEmpty());
        assertTrue(sink.getOutbound().isEmpty());
    }

    @Test
    void disconnectWhileDisconnectedIsANoOp() {
        manager.disconnect();

        assertEquals(0, endpoint.closeCount());
        assertTrue(terminations.isEmpty());
    }

    @Test
    void connectRequiresAListener() {
        ConnectionManager bare = new ConnectionManager(PLUGIN_ID, new FakeStreamEndpoint(),
                new JsonLineCodec(), Duration.ofMillis(5), null);

        assertThrows(IllegalStateException.class, bare::connect);
    }

    @Test
    void failingListenerDoesNotStopTheLoop() throws Exception {
        ConnectionManager.Listener failing = new ConnectionManager.Listener() {
            @Override
            public void onLine(String line) {
                if (line.contains("bad")) {
                    throw new IllegalStateException("boom");
                }
                lines.add(line);
            }

            @Override
            public void onTerminated(DisconnectReason reason, Throwable cause) {
                terminations.add(new Terminated(reason, cause));
            }
        };
        manager.setListener(failing);
        connectInBackground();

        endpoint.injectLine("{\"type\":\"bad\"}");
        endpoint.injectLine("{\"type\":\"good\"}");

        Eventually.await(() -> lines.size() == 1, "line after failure");
        assertEquals(1, sink.getErrors(ErrorCategory.PROTOCOL).size());
        assertTrue(manager.isConnected());
    }

    @Test
    void clientCanReconnectAfterDisconnect() throws Exception {
        Future<DisconnectReason> first = connectInBackground();
        manager.disconnect();
        assertEquals(DisconnectReason.REQUESTED, first.get(2, TimeUnit.SECONDS));
        endpoint.clear();

        CompletableFuture<DisconnectReason> second = CompletableFuture.supplyAsync(manager::connect, loopThread);
        Eventually.await(() -> !endpoint.writtenLines().isEmpty(), "second pairing message");

        assertEquals(2, endpoint.openCount());
        assertTrue(manager.send(OutboundMessage.stateUpdate("a.b", "1")));
        manager.disconnect();
        assertEquals(DisconnectReason.REQUESTED, second.get(2, TimeUnit.SECONDS));
        assertEquals(2, terminations.size());
    }
}
