package com.questrail.touchportal.api;

/**
 * Lifecycle of the controller connection.
 *
 * <pre>
 *   DISCONNECTED → CONNECTING → CONNECTED → DISCONNECTED
 * </pre>
 */
public enum ConnectionState
{
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
