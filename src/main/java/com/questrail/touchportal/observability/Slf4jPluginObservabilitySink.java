package com.questrail.touchportal.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of PluginObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jPluginObservabilitySink implements PluginObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jPluginObservabilitySink.class);

    @Override
    public void onConnectionTransition(ConnectionTransitionEvent event) {
        log.info("Controller connection: {} -> {}", event.oldState(), event.newState());
    }

    @Override
    public void onInbound(String line) {
        log.debug("<< {}", line);
    }

    @Override
    public void onOutbound(String line) {
        log.debug(">> {}", line);
    }

    @Override
    public void onError(PluginErrorEvent event) {
        if (event.category() == ErrorCategory.PROTOCOL) {
            log.warn("Protocol error: {} (line: {})", event.message(), event.rawLine(), event.cause());
        } else {
            log.error("{} error: {}", event.category(), event.message(), event.cause());
        }
    }
}
