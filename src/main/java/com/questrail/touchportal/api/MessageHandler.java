package com.questrail.touchportal.api;

import com.questrail.touchportal.protocol.InboundMessage;

/**
 * Callback for decoded inbound messages.
 *
 * <p>Handlers run on the client's worker pool, never on the connection loop
 * thread. Handlers for distinct messages may run in parallel and complete out
 * of arrival order. Anything thrown is caught by the dispatcher and reported
 * as a {@code HANDLER} error event.</p>
 */
@FunctionalInterface
public interface MessageHandler
{
    void handle(InboundMessage message) throws Exception;
}
