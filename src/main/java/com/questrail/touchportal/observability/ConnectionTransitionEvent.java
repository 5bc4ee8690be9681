package com.questrail.touchportal.observability;

import com.questrail.touchportal.api.ConnectionState;

import java.time.Instant;

/**
 * Record representing a change of the controller connection state.
 */
public record ConnectionTransitionEvent(
    Instant timestamp,
    ConnectionState oldState,
    ConnectionState newState
) {
    public boolean isEstablished() {
        return newState == ConnectionState.CONNECTED;
    }
}
