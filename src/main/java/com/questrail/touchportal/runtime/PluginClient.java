package com.questrail.touchportal.runtime;

import com.questrail.touchportal.api.ConnectionState;
import com.questrail.touchportal.api.DisconnectReason;
import com.questrail.touchportal.api.ErrorHandler;
import com.questrail.touchportal.api.MessageHandler;
import com.questrail.touchportal.api.MessageKind;
import com.questrail.touchportal.config.PluginClientConfig;
import com.questrail.touchportal.observability.ErrorCategory;
import com.questrail.touchportal.observability.NullObservabilitySink;
import com.questrail.touchportal.observability.PluginErrorEvent;
import com.questrail.touchportal.observability.PluginObservabilitySink;
import com.questrail.touchportal.protocol.InboundMessage;
import com.questrail.touchportal.protocol.JsonLineCodec;
import com.questrail.touchportal.protocol.NotificationOption;
import com.questrail.touchportal.protocol.OutboundMessage;
import com.questrail.touchportal.state.StateDefinition;
import com.questrail.touchportal.state.StateStore;
import com.questrail.touchportal.transport.StreamEndpoint;
import com.questrail.touchportal.transport.netty.NettyTcpStreamEndpoint;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * PluginClient
 * =============================================================================
 * Composition root and lifecycle owner of one plugin runtime: a
 * {@link ConnectionManager}, a {@link MessageDispatcher}, a {@link StateStore}
 * and the handler registration table.
 *
 * <p>A process may construct several independent clients.</p>
 *
 * <h2>Typical use</h2>
 * <pre>
 *   PluginClient client = PluginClient.builder()
 *       .withConfig(PluginClientConfig.builder().withPluginId("com.example.plugin").build())
 *       .withObservabilitySink(new Slf4jPluginObservabilitySink())
 *       .build();
 *   client.on(MessageKind.ACTION, m -&gt; client.stateUpdate("com.example.plugin.state", "1"));
 *   client.connect();   // blocks until disconnected
 *   client.close();
 * </pre>
 *
 * <h2>Runtime bookkeeping</h2>
 * Before user handlers run, each accepted message updates the runtime:
 * <ul>
 *   <li>{@code down}/{@code up} mark the action instance held or released</li>
 *   <li>{@code broadcast} re-sends every known state (configurable)</li>
 *   <li>{@code settings}/{@code info} record the controller's setting values</li>
 *   <li>{@code closePlugin} disconnects (configurable)</li>
 * </ul>
 */
public final class PluginClient implements AutoCloseable
{
    private final PluginClientConfig config;
    private final ConnectionManager connection;
    private final MessageDispatcher dispatcher;
    private final StateStore store;
    private final HandlerRegistry registry;
    private final ExecutorService ownedExecutor;

    private PluginClient(PluginClientConfig config,
                         StreamEndpoint endpoint,
                         Executor executor,
                         ExecutorService ownedExecutor,
                         PluginObservabilitySink sink)
    {
        this.config = config;
        this.ownedExecutor = ownedExecutor;
        this.registry = new HandlerRegistry();

        JsonLineCodec codec = new JsonLineCodec();
        this.connection = new ConnectionManager(config.pluginId(), endpoint, codec, config.pollInterval(), sink);
        this.store = new StateStore(connection::send, config.strictStateIds());
        this.dispatcher = new MessageDispatcher(codec, registry, executor, sink,
                config.pluginId(), config.checkPluginId(), this::intercept);

        connection.setListener(new ConnectionManager.Listener() {
            @Override
            public void onLine(String line) {
                dispatcher.dispatch(line);
            }

            @Override
            public void onTerminated(DisconnectReason reason, Throwable cause) {
                store.clearHeld();
                if (reason.isFailure()) {
                    dispatcher.raiseError(PluginErrorEvent.of(ErrorCategory.TRANSPORT,
                            "Connection ended: " + reason, cause, null));
                }
            }
        });
    }

    public static Builder builder() {
        return new Builder();
    }

    public PluginClientConfig config() {
        return config;
    }

    // -------------------------------------------------------------------------
    // Registration
    // -------------------------------------------------------------------------

    public PluginClient on(MessageKind kind, MessageHandler handler) {
        registry.register(kind, handler);
        return this;
    }

    /**
     * Registers a handler that receives every decoded message.
     */
    public PluginClient onAny(MessageHandler handler) {
        registry.registerAny(handler);
        return this;
    }

    public PluginClient onError(ErrorHandler handler) {
        registry.registerError(handler);
        return this;
    }

    // -------------------------------------------------------------------------
    // Connection
    // -------------------------------------------------------------------------

    /**
     * Connects and runs until the connection ends. See {@link ConnectionManager#connect()}.
     */
    public DisconnectReason connect() {
        return connection.connect();
    }

    /**
     * Idempotent; safe to call from handlers.
     */
    public void disconnect() {
        connection.disconnect();
    }

    public boolean isConnected() {
        return connection.isConnected();
    }

    public ConnectionState connectionState() {
        return connection.state();
    }

    // -------------------------------------------------------------------------
    // States and settings
    // -------------------------------------------------------------------------

    /**
     * Creates a runtime state, or updates the value of an existing one while
     * keeping its original description.
     */
    public void createState(String stateId, String description, String value) {
        store.createOrUpdateState(stateId, description, value);
    }

    public void createStates(Collection<StateDefinition> states) {
        Objects.requireNonNull(states, "states");
        for (StateDefinition s : states) {
            store.createOrUpdateState(s.id(), s.description(), s.value());
        }
    }

    /**
     * Records a state declared in the descriptor so updates to it are tracked
     * and re-sent on broadcast. Nothing is sent.
     */
    public void declareState(String stateId, String description, String defaultValue) {
        store.declare(stateId, description, defaultValue);
    }

    /**
     * Removes a state. Unknown ids are ignored.
     */
    public void removeState(String stateId) {
        store.removeState(stateId);
    }

    /**
     * @throws IllegalArgumentException if {@code validateExists} and the id is unknown
     */
    public void removeState(String stateId, boolean validateExists) {
        if (!store.removeState(stateId) && validateExists) {
            throw new IllegalArgumentException("State '" + stateId + "' does not exist");
        }
    }

    public void removeStates(Collection<String> stateIds) {
        Objects.requireNonNull(stateIds, "stateIds");
        stateIds.forEach(store::removeState);
    }

    /**
     * Sends a new state value unless it equals the last one sent.
     *
     * @throws IllegalStateException for an unknown id when {@code strictStateIds} is enabled
     */
    public void stateUpdate(String stateId, String value) {
        store.updateValue(stateId, value);
    }

    public void stateUpdates(Map<String, String> values) {
        Objects.requireNonNull(values, "values");
        values.forEach(store::updateValue);
    }

    /**
     * Sends a new setting value unless it equals the last one known.
     */
    public void settingUpdate(String name, String value) {
        store.updateSetting(name, value);
    }

    public StateStore stateStore() {
        return store;
    }

    public boolean isActionBeingHeld(String actionId) {
        return store.isHeld(actionId);
    }

    public boolean isActionBeingHeld(String actionId, String instanceId) {
        return store.isHeld(actionId, instanceId);
    }

    // -------------------------------------------------------------------------
    // Other outbound messages
    // -------------------------------------------------------------------------

    public boolean choiceUpdate(String choiceId, List<String> values) {
        return connection.send(OutboundMessage.choiceUpdate(choiceId, values));
    }

    public boolean choiceUpdateSpecific(String choiceId, List<String> values, String instanceId) {
        return connection.send(OutboundMessage.choiceUpdate(choiceId, values, instanceId));
    }

    /**
     * @param connectorId connector id without the {@code pc_<pluginId>_} prefix
     * @throws IllegalArgumentException if {@code value} is outside 0..100
     */
    public boolean connectorUpdate(String connectorId, int value) {
        return connection.send(OutboundMessage.connectorUpdate(config.pluginId(), connectorId, value));
    }

    public boolean showNotification(String notificationId, String title, String msg, List<NotificationOption> options) {
        return connection.send(OutboundMessage.showNotification(notificationId, title, msg, options));
    }

    public boolean updateActionData(String instanceId, String dataId, Number minValue, Number maxValue) {
        return connection.send(OutboundMessage.updateActionData(instanceId, dataId, minValue, maxValue));
    }

    /**
     * Sends a caller-built message, which must carry a textual {@code type}.
     */
    public boolean send(Map<String, ?> message) {
        return connection.send(OutboundMessage.passthrough(message));
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Disconnects and shuts down the worker pool if this client created it.
     */
    @Override
    public void close() {
        connection.disconnect();
        if (ownedExecutor == null) {
            return;
        }
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                ownedExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ownedExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void intercept(InboundMessage message) {
        switch (message.kind()) {
            case CLOSE_PLUGIN -> {
                if (config.autoClose()) {
                    connection.disconnect();
                }
            }
            case HOLD_DOWN -> message.actionId()
                    .ifPresent(id -> store.setHeld(id, message.instanceId().orElse(""), true));
            case HOLD_UP -> message.actionId()
                    .ifPresent(id -> store.setHeld(id, message.instanceId().orElse(""), false));
            case BROADCAST -> {
                if (config.updateStatesOnBroadcast()) {
                    store.resendAll();
                }
            }
            case SETTINGS, INFO -> message.settingValues().forEach(store::recordSetting);
            default -> { }
        }
    }

    public static final class Builder {
        private PluginClientConfig config;
        private StreamEndpoint endpoint;
        private Executor executor;
        private PluginObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withConfig(PluginClientConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Replaces the default Netty TCP endpoint, e.g. with a test double.
         */
        public Builder withEndpoint(StreamEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        /**
         * Runs handlers on a caller-owned executor instead of a pool of
         * {@code workerThreads} threads owned by the client.
         */
        public Builder withExecutor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public Builder withObservabilitySink(PluginObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public PluginClient build() {
            Objects.requireNonNull(config, "config");

            StreamEndpoint ep = endpoint != null
                    ? endpoint
                    : new NettyTcpStreamEndpoint(config.host(), config.port(), config.connectTimeout());

            ExecutorService owned = null;
            Executor exec = executor;
            if (exec == null) {
                owned = Executors.newFixedThreadPool(config.workerThreads(), new HandlerThreadFactory());
                exec = owned;
            }
            return new PluginClient(config, ep, exec, owned,
                    Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE));
        }
    }

    private static final class HandlerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "touchportal-handler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
