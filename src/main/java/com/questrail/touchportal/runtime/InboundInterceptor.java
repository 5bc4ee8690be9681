package com.questrail.touchportal.runtime;

import com.questrail.touchportal.protocol.InboundMessage;

/**
 * Runtime bookkeeping applied to each accepted message on the loop thread,
 * before user handlers are submitted. Must not block.
 */
@FunctionalInterface
public interface InboundInterceptor
{
    InboundInterceptor NONE = message -> { };

    void intercept(InboundMessage message);
}
