package com.questrail.touchportal.api;

import com.questrail.touchportal.observability.PluginErrorEvent;

/**
 * Callback for error-kind events (transport, protocol and handler failures).
 */
@FunctionalInterface
public interface ErrorHandler
{
    void onError(PluginErrorEvent event);
}
