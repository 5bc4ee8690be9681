package com.questrail.touchportal.api;

/**
 * Why a blocking {@code connect()} call returned.
 */
public enum DisconnectReason
{
    /** {@code disconnect()} was called, by a handler or externally. */
    REQUESTED,

    /** The controller closed the socket. */
    PEER_CLOSED,

    /** The socket failed while connected. */
    TRANSPORT_ERROR,

    /** The socket could not be opened. */
    CONNECT_FAILED,

    /** {@code connect()} was called while a connection was already active. */
    ALREADY_CONNECTED;

    /**
     * Whether this reason reflects a failure rather than a clean shutdown.
     */
    public boolean isFailure() {
        return this == PEER_CLOSED || this == TRANSPORT_ERROR || this == CONNECT_FAILED;
    }
}
