package com.questrail.touchportal.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for a plugin client.
 *
 * @param pluginId                plugin identifier, sent when pairing and used for
 *                                identity checks and connector ids
 * @param pollInterval            bounded wait of the connection loop between reads
 * @param autoClose               disconnect when the controller sends {@code closePlugin}
 * @param checkPluginId           reject inbound messages addressed to another plugin
 * @param updateStatesOnBroadcast re-send every known state on {@code broadcast}
 * @param workerThreads           size of the handler pool created when no executor is supplied
 * @param strictStateIds          reject state updates for ids never created or declared
 */
public record PluginClientConfig(
    String pluginId,
    String host,
    int port,
    Duration pollInterval,
    Duration connectTimeout,
    boolean autoClose,
    boolean checkPluginId,
    boolean updateStatesOnBroadcast,
    int workerThreads,
    boolean strictStateIds
) {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 12136;

    public PluginClientConfig {
        Objects.requireNonNull(pluginId, "pluginId");
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (pluginId.isBlank()) {
            throw new IllegalArgumentException("pluginId must not be blank");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String pluginId;
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private Duration pollInterval = Duration.ofMillis(10);
        private Duration connectTimeout = Duration.ofSeconds(5);
        private boolean autoClose = false;
        private boolean checkPluginId = true;
        private boolean updateStatesOnBroadcast = true;
        private int workerThreads = 4;
        private boolean strictStateIds = false;

        public Builder withPluginId(String pluginId) {
            this.pluginId = pluginId;
            return this;
        }

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withAutoClose(boolean autoClose) {
            this.autoClose = autoClose;
            return this;
        }

        public Builder withCheckPluginId(boolean checkPluginId) {
            this.checkPluginId = checkPluginId;
            return this;
        }

        public Builder withUpdateStatesOnBroadcast(boolean enabled) {
            this.updateStatesOnBroadcast = enabled;
            return this;
        }

        public Builder withWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder withStrictStateIds(boolean strict) {
            this.strictStateIds = strict;
            return this;
        }

        public PluginClientConfig build() {
            return new PluginClientConfig(pluginId, host, port, pollInterval, connectTimeout,
                    autoClose, checkPluginId, updateStatesOnBroadcast, workerThreads, strictStateIds);
        }
    }
}
