package com.questrail.touchportal.runtime;

import com.questrail.touchportal.api.ErrorHandler;
import com.questrail.touchportal.api.MessageHandler;
import com.questrail.touchportal.api.MessageKind;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Handler registration table: an ordered handler list per {@link MessageKind},
 * plus all-messages and error handlers.
 *
 * <p>Read-mostly. Registration is expected before {@code connect()}; lists are
 * copy-on-write so a late registration never disturbs a dispatch in progress.</p>
 */
public final class HandlerRegistry
{
    private final Map<MessageKind, List<MessageHandler>> byKind = new EnumMap<>(MessageKind.class);
    private final List<MessageHandler> anyHandlers = new CopyOnWriteArrayList<>();
    private final List<ErrorHandler> errorHandlers = new CopyOnWriteArrayList<>();

    public HandlerRegistry() {
        for (MessageKind kind : MessageKind.values()) {
            byKind.put(kind, new CopyOnWriteArrayList<>());
        }
    }

    public void register(MessageKind kind, MessageHandler handler) {
        Objects.requireNonNull(kind, "kind");
        byKind.get(kind).add(Objects.requireNonNull(handler, "handler"));
    }

    /**
     * Registers a handler that receives every decoded message regardless of kind.
     */
    public void registerAny(MessageHandler handler) {
        anyHandlers.add(Objects.requireNonNull(handler, "handler"));
    }

    public void registerError(ErrorHandler handler) {
        errorHandlers.add(Objects.requireNonNull(handler, "handler"));
    }

    public List<MessageHandler> handlersFor(MessageKind kind) {
        return List.copyOf(byKind.get(kind));
    }

    public List<MessageHandler> anyHandlers() {
        return List.copyOf(anyHandlers);
    }

    public List<ErrorHandler> errorHandlers() {
        return List.copyOf(errorHandlers);
    }
}
