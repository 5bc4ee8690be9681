package com.questrail.touchportal.transport.netty;

import com.questrail.touchportal.api.DisconnectReason;
import com.questrail.touchportal.api.MessageKind;
import com.questrail.touchportal.config.PluginClientConfig;
import com.questrail.touchportal.protocol.InboundMessage;
import com.questrail.touchportal.runtime.PluginClient;
import com.questrail.touchportal.transport.StreamEndpointListener;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs a client against a loopback socket standing in for the controller.
 */
final class NettyTcpStreamEndpointIntegrationTest {

    private static PluginClient client(int port) {
        return PluginClient.builder()
                .withConfig(PluginClientConfig.builder()
                        .withPluginId("com.example.plugin")
                        .withHost("127.0.0.1")
                        .withPort(port)
                        .withConnectTimeout(Duration.ofSeconds(2))
                        .withWorkerThreads(1)
                        .build())
                .build();
    }

    @Test
    void pairsReceivesLinesAndReportsPeerClose() throws Exception {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
             PluginClient client = client(server.getLocalPort())) {

            BlockingQueue<InboundMessage> actions = new ArrayBlockingQueue<>(4);
            client.on(MessageKind.ACTION, actions::add);
            CompletableFuture<DisconnectReason> running = CompletableFuture.supplyAsync(client::connect);

            try (Socket controller = server.accept()) {
                controller.setSoTimeout(2_000);
                BufferedReader in = new BufferedReader(
                        new InputStreamReader(controller.getInputStream(), StandardCharsets.UTF_8));
                assertEquals("{\"type\":\"pair\",\"id\":\"com.example.plugin\"}", in.readLine());

                OutputStream out = controller.getOutputStream();
                out.write(("{\"type\":\"info\",\"status\":\"paired\",\"settings\":[]}\n"
                        + "{\"type\":\"action\",\"pluginId\":\"com.example.plugin\",\"actionId\":\"com.example.plugin.main.beep\","
                        + "\"data\":[{\"id\":\"com.example.plugin.main.beep.volume\",\"value\":\"42\"}]}\n")
                        .getBytes(StandardCharsets.UTF_8));
                out.flush();

                InboundMessage action = actions.poll(2, TimeUnit.SECONDS);
                assertNotNull(action, "action was not dispatched");
                assertEquals("42", action.dataValue("com.example.plugin.main.beep.volume").orElseThrow());

                client.stateUpdate("com.example.plugin.main.status", "busy");
                assertEquals("{\"type\":\"stateUpdate\",\"id\":\"com.example.plugin.main.status\",\"value\":\"busy\"}",
                        in.readLine());
            }

            assertEquals(DisconnectReason.PEER_CLOSED, running.get(5, TimeUnit.SECONDS));
            assertFalse(client.isConnected());
        }
    }

    @Test
    void writesAreRefusedOnceThePeerStopsReading() throws Exception {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            NettyTcpStreamEndpoint endpoint =
                    new NettyTcpStreamEndpoint("127.0.0.1", server.getLocalPort(), Duration.ofSeconds(2));
            endpoint.setListener(new StreamEndpointListener() {
                @Override
                public void onBytes(byte[] chunk) {
                }

                @Override
                public void onClosed(Throwable cause) {
                }
            });
            endpoint.open();

            try (Socket silent = server.accept()) {
                byte[] chunk = new byte[16 * 1024];
                boolean refused = false;
                for (int i = 0; i < 4096 && !refused; i++) {
                    refused = !endpoint.write(chunk);
                }
                assertTrue(refused, "outbound buffer grew without bound");
            } finally {
                endpoint.close();
            }
        }
    }

    @Test
    void refusedConnectionIsReported() throws IOException {
        int port;
        try (ServerSocket released = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = released.getLocalPort();
        }

        try (PluginClient client = client(port)) {
            assertEquals(DisconnectReason.CONNECT_FAILED, client.connect());
            assertFalse(client.isConnected());
        }
    }
}
