package com.questrail.touchportal.runtime;

import com.questrail.touchportal.api.ErrorHandler;
import com.questrail.touchportal.api.MessageHandler;
import com.questrail.touchportal.observability.ErrorCategory;
import com.questrail.touchportal.observability.NullObservabilitySink;
import com.questrail.touchportal.observability.PluginErrorEvent;
import com.questrail.touchportal.observability.PluginObservabilitySink;
import com.questrail.touchportal.protocol.InboundMessage;
import com.questrail.touchportal.protocol.JsonLineCodec;
import com.questrail.touchportal.protocol.ProtocolDecodeException;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * MessageDispatcher
 * =============================================================================
 * Turns complete lines into handler invocations.
 *
 * <h2>Per line</h2>
 * <ol>
 *   <li>Decode. A line that fails to decode is dropped and reported as a
 *       {@link ErrorCategory#PROTOCOL} event; the connection continues.</li>
 *   <li>Identity check. A message carrying a {@code pluginId} other than ours is
 *       reported as {@code PROTOCOL} and not dispatched (when enabled).</li>
 *   <li>Run the {@link InboundInterceptor} on the calling (loop) thread.</li>
 *   <li>Submit one task per handler registered for the message's kind, then one
 *       per all-messages handler.</li>
 * </ol>
 *
 * <h2>Isolation</h2>
 * Every handler invocation is its own task on the worker {@link Executor}, so
 * handlers for different messages may run in parallel and complete out of order.
 * Anything a handler throws becomes one {@link ErrorCategory#HANDLER} event;
 * other handlers and the loop are unaffected.
 *
 * <p>Error events go to the observability sink and are submitted to every
 * registered {@link ErrorHandler}. A failing error handler is only logged.</p>
 */
public final class MessageDispatcher
{
    private final JsonLineCodec codec;
    private final HandlerRegistry registry;
    private final Executor executor;
    private final PluginObservabilitySink sink;
    private final String pluginId;
    private final boolean checkPluginId;
    private final InboundInterceptor interceptor;

    public MessageDispatcher(JsonLineCodec codec,
                             HandlerRegistry registry,
                             Executor executor,
                             PluginObservabilitySink sink,
                             String pluginId,
                             boolean checkPluginId,
                             InboundInterceptor interceptor)
    {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.sink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);
        this.pluginId = Objects.requireNonNull(pluginId, "pluginId");
        this.checkPluginId = checkPluginId;
        this.interceptor = Objects.requireNonNullElse(interceptor, InboundInterceptor.NONE);
    }

    /**
     * Decodes and dispatches one line. Never throws for bad input.
     */
    public void dispatch(String line) {
        Objects.requireNonNull(line, "line");

        final InboundMessage message;
        try {
            message = codec.decode(line);
        } catch (ProtocolDecodeException e) {
            raiseError(PluginErrorEvent.of(ErrorCategory.PROTOCOL, e.getMessage(), e, line));
            return;
        }

        Optional<String> addressedTo = message.pluginId();
        if (checkPluginId && addressedTo.isPresent() && !addressedTo.get().equals(pluginId)) {
            raiseError(PluginErrorEvent.of(ErrorCategory.PROTOCOL,
                    "Message for plugin '" + addressedTo.get() + "' ignored", null, line));
            return;
        }

        try {
            interceptor.intercept(message);
        } catch (RuntimeException e) {
            raiseError(PluginErrorEvent.of(ErrorCategory.HANDLER,
                    "Runtime bookkeeping failed for " + message.type(), e, line));
        }

        for (MessageHandler handler : registry.handlersFor(message.kind())) {
            submit(handler, message, line);
        }
        for (MessageHandler handler : registry.anyHandlers()) {
            submit(handler, message, line);
        }
    }

    /**
     * Reports an error event to the sink and to every error handler.
     */
    public void raiseError(PluginErrorEvent event) {
        Objects.requireNonNull(event, "event");
        sink.onError(event);
        for (ErrorHandler handler : registry.errorHandlers()) {
            try {
                executor.execute(() -> {
                    try {
                        handler.onError(event);
                    } catch (RuntimeException e) {
                        sink.onError(PluginErrorEvent.of(ErrorCategory.HANDLER,
                                "Error handler failed", e, event.rawLine()));
                    }
                });
            } catch (RejectedExecutionException e) {
                sink.onError(PluginErrorEvent.of(ErrorCategory.HANDLER,
                        "Worker pool rejected error handler", e, event.rawLine()));
            }
        }
    }

    private void submit(MessageHandler handler, InboundMessage message, String line) {
        try {
            executor.execute(() -> {
                try {
                    handler.handle(message);
                } catch (Exception e) {
                    raiseError(PluginErrorEvent.of(ErrorCategory.HANDLER,
                            "Handler for " + message.type() + " failed: " + e, e, line));
                }
            });
        } catch (RejectedExecutionException e) {
            sink.onError(PluginErrorEvent.of(ErrorCategory.HANDLER,
                    "Worker pool rejected handler for " + message.type(), e, line));
        }
    }
}
