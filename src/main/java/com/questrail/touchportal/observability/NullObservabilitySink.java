package com.questrail.touchportal.observability;

/**
 * No-op implementation of PluginObservabilitySink.
 */
public final class NullObservabilitySink implements PluginObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onConnectionTransition(ConnectionTransitionEvent event) {}

    @Override
    public void onInbound(String line) {}

    @Override
    public void onOutbound(String line) {}

    @Override
    public void onError(PluginErrorEvent event) {}
}
