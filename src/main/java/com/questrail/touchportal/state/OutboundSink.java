package com.questrail.touchportal.state;

import com.questrail.touchportal.protocol.OutboundMessage;

/**
 * Where the store sends its writes. Implemented by the connection.
 */
@FunctionalInterface
public interface OutboundSink
{
    /**
     * @return {@code false} if the message was dropped because no connection is active
     */
    boolean send(OutboundMessage message);
}
