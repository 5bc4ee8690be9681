package com.questrail.touchportal.state;

import com.questrail.touchportal.protocol.OutboundMessage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * StateStore
 * =============================================================================
 * Thread-safe model of the plugin's runtime entities: states, setting values
 * and held actions.
 *
 * <h2>Write suppression</h2>
 * A state or setting write reaches the wire only when its value differs, by
 * string equality, from the value last recorded for that key. No two
 * consecutive writes for the same key carry the same value.
 *
 * <h2>Concurrency</h2>
 * All operations take one store-wide lock. The compare, the record update and
 * the hand-off to the {@link OutboundSink} happen under that lock, so two
 * racing writers for the same key can never both observe a change. The sink
 * only serializes and writes a line, which keeps the critical section short.
 *
 * <p>A value is recorded even when the sink drops the write because no
 * connection is active; it is delivered on the next forced {@link #resendAll()}.</p>
 */
public final class StateStore
{
    private final Object lock = new Object();
    private final OutboundSink sink;
    private final boolean strict;

    private final Map<String, RuntimeStateRecord> states = new LinkedHashMap<>();
    private final Map<String, String> settings = new LinkedHashMap<>();
    private final Map<String, Set<String>> held = new HashMap<>();

    /**
     * @param strict whether {@link #updateValue} rejects ids that were never
     *               created or declared
     */
    public StateStore(OutboundSink sink, boolean strict) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.strict = strict;
    }

    // -------------------------------------------------------------------------
    // States
    // -------------------------------------------------------------------------

    /**
     * Creates a runtime state, or updates the value of an existing one. The
     * description of an existing state is never changed.
     *
     * @return {@code true} if the state was created, {@code false} if it existed
     */
    public boolean createOrUpdateState(String id, String description, String value) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(value, "value");
        synchronized (lock) {
            if (states.containsKey(id)) {
                writeState(id, value, false);
                return false;
            }
            states.put(id, new RuntimeStateRecord(id, description, value, StateOrigin.DYNAMIC));
            sink.send(OutboundMessage.createState(id, description, value));
            return true;
        }
    }

    /**
     * Records a state the descriptor already declares. Nothing is sent.
     */
    public void declare(String id, String description, String defaultValue) {
        Objects.requireNonNull(id, "id");
        synchronized (lock) {
            states.putIfAbsent(id, new RuntimeStateRecord(id, description, defaultValue, StateOrigin.STATIC));
        }
    }

    /**
     * Removes a state. An unknown id is ignored.
     *
     * @return whether the id was known
     */
    public boolean removeState(String id) {
        Objects.requireNonNull(id, "id");
        synchronized (lock) {
            if (states.remove(id) == null) {
                return false;
            }
            sink.send(OutboundMessage.removeState(id));
            return true;
        }
    }

    /**
     * Writes a state value unless it equals the last recorded one.
     *
     * @return whether a write was attempted
     * @throws IllegalStateException in strict mode, for an id that was never
     *         created or declared
     */
    public boolean updateValue(String id, String value) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(value, "value");
        synchronized (lock) {
            if (!states.containsKey(id)) {
                if (strict) {
                    throw new IllegalStateException("State '" + id + "' was never created or declared");
                }
                states.put(id, new RuntimeStateRecord(id, "", value, StateOrigin.STATIC));
                sink.send(OutboundMessage.stateUpdate(id, value));
                return true;
            }
            return writeState(id, value, false);
        }
    }

    /**
     * Sends the current value of every known state, bypassing suppression.
     *
     * @return number of states sent
     */
    public int resendAll() {
        synchronized (lock) {
            List<String> ids = new ArrayList<>(states.keySet());
            for (String id : ids) {
                writeState(id, states.get(id).value(), true);
            }
            return ids.size();
        }
    }

    public Optional<RuntimeStateRecord> state(String id) {
        synchronized (lock) {
            return Optional.ofNullable(states.get(id));
        }
    }

    public Optional<String> value(String id) {
        return state(id).map(RuntimeStateRecord::value);
    }

    public boolean contains(String id) {
        synchronized (lock) {
            return states.containsKey(id);
        }
    }

    /**
     * Snapshot of all known states in creation order.
     */
    public List<RuntimeStateRecord> states() {
        synchronized (lock) {
            return List.copyOf(states.values());
        }
    }

    private boolean writeState(String id, String value, boolean forced) {
        RuntimeStateRecord current = states.get(id);
        if (!forced && current.value().equals(value)) {
            return false;
        }
        states.put(id, current.withValue(value));
        sink.send(OutboundMessage.stateUpdate(id, value));
        return true;
    }

    // -------------------------------------------------------------------------
    // Settings
    // -------------------------------------------------------------------------

    /**
     * Writes a setting value unless it equals the last recorded one.
     *
     * @return whether a write was attempted
     */
    public boolean updateSetting(String name, String value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        synchronized (lock) {
            if (value.equals(settings.get(name))) {
                return false;
            }
            settings.put(name, value);
            sink.send(OutboundMessage.settingUpdate(name, value));
            return true;
        }
    }

    /**
     * Records a value reported by the controller. Nothing is sent.
     */
    public void recordSetting(String name, String value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        synchronized (lock) {
            settings.put(name, value);
        }
    }

    public Optional<String> setting(String name) {
        synchronized (lock) {
            return Optional.ofNullable(settings.get(name));
        }
    }

    public Map<String, String> settings() {
        synchronized (lock) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(settings));
        }
    }

    // -------------------------------------------------------------------------
    // Held actions
    // -------------------------------------------------------------------------

    public void setHeld(String actionId, String instanceId, boolean isHeld) {
        Objects.requireNonNull(actionId, "actionId");
        Objects.requireNonNull(instanceId, "instanceId");
        synchronized (lock) {
            if (isHeld) {
                held.computeIfAbsent(actionId, k -> new HashSet<>()).add(instanceId);
                return;
            }
            Set<String> instances = held.get(actionId);
            if (instances != null) {
                instances.remove(instanceId);
                if (instances.isEmpty()) {
                    held.remove(actionId);
                }
            }
        }
    }

    /**
     * Whether any instance of the action is held. Never-tracked actions are not held.
     */
    public boolean isHeld(String actionId) {
        synchronized (lock) {
            return held.containsKey(actionId);
        }
    }

    public boolean isHeld(String actionId, String instanceId) {
        synchronized (lock) {
            Set<String> instances = held.get(actionId);
            return instances != null && instances.contains(instanceId);
        }
    }

    /**
     * Forgets all hold status, e.g. after the connection ends.
     */
    public void clearHeld() {
        synchronized (lock) {
            held.clear();
        }
    }
}
