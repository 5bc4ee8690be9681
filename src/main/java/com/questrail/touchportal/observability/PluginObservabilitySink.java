package com.questrail.touchportal.observability;

/**
 * Main interface for receiving plugin runtime observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Methods may be called from the connection loop thread and from handler
 * worker threads; implementations must be thread-safe and must not block.</p>
 */
public interface PluginObservabilitySink {
    /**
     * Called when the connection state changes.
     * @param event the transition details
     */
    void onConnectionTransition(ConnectionTransitionEvent event);

    /**
     * Called for every complete line received from the controller, before decoding.
     * @param line the raw JSON line without its terminator
     */
    void onInbound(String line);

    /**
     * Called for every message written to the controller.
     * @param line the encoded JSON line without its terminator
     */
    void onOutbound(String line);

    /**
     * Called when an error or anomaly occurs in the runtime.
     * @param event the error event
     */
    void onError(PluginErrorEvent event);
}
