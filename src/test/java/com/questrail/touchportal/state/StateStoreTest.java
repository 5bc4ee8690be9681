package com.questrail.touchportal.state;

import com.questrail.touchportal.protocol.OutboundKind;
import com.questrail.touchportal.protocol.OutboundMessage;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class StateStoreTest {

    private final List<OutboundMessage> sent = Collections.synchronizedList(new ArrayList<>());
    private boolean connected = true;

    private final StateStore store = new StateStore(message -> {
        sent.add(message);
        return connected;
    }, false);

    @Test
    void createSendsCreateStateOnce() {
        assertTrue(store.createOrUpdateState("a.b", "Label", "0"));
        assertFalse(store.createOrUpdateState("a.b", "Other label", "0"));

        assertEquals(List.of(OutboundMessage.createState("a.b", "Label", "0")), sent);
        assertEquals(StateOrigin.DYNAMIC, store.state("a.b").orElseThrow().origin());
    }

    @Test
    void recreatingExistingStateUpdatesValueButKeepsDescription() {
        store.createOrUpdateState("a.b", "Label", "0");
        store.createOrUpdateState("a.b", "Other label", "1");

        assertEquals(OutboundMessage.stateUpdate("a.b", "1"), sent.get(1));
        RuntimeStateRecord record = store.state("a.b").orElseThrow();
        assertEquals("Label", record.description());
        assertEquals("1", record.value());
    }

    @Test
    void repeatedValueIsSuppressed() {
        store.createOrUpdateState("a.b", "Label", "0");
        sent.clear();

        assertTrue(store.updateValue("a.b", "1"));
        assertFalse(store.updateValue("a.b", "1"));
        assertTrue(store.updateValue("a.b", "2"));
        assertTrue(store.updateValue("a.b", "1"));

        assertEquals(3, sent.size());
        assertEquals("1", sent.get(2).get("value"));
    }

    @Test
    void declaredStateSendsNothingUntilValueChanges() {
        store.declare("com.example.plugin.main.status", "Status", "idle");

        assertTrue(sent.isEmpty());
        assertFalse(store.updateValue("com.example.plugin.main.status", "idle"));
        assertTrue(store.updateValue("com.example.plugin.main.status", "busy"));
        assertEquals(StateOrigin.STATIC, store.state("com.example.plugin.main.status").orElseThrow().origin());
    }

    @Test
    void unknownStateIsTrackedInLenientMode() {
        assertTrue(store.updateValue("never.declared", "x"));
        assertFalse(store.updateValue("never.declared", "x"));

        assertEquals(1, sent.size());
        assertEquals(OutboundKind.STATE_UPDATE, sent.get(0).kind());
        assertTrue(store.contains("never.declared"));
    }

    @Test
    void unknownStateIsRejectedInStrictMode() {
        StateStore strict = new StateStore(sent::add, true);

        assertThrows(IllegalStateException.class, () -> strict.updateValue("never.declared", "x"));
        assertTrue(sent.isEmpty());
    }

    @Test
    void removingUnknownStateIsANoOp() {
        assertFalse(store.removeState("missing"));
        assertTrue(sent.isEmpty());
    }

    @Test
    void removeForgetsLastValue() {
        store.createOrUpdateState("a.b", "Label", "0");
        assertTrue(store.removeState("a.b"));
        assertEquals(OutboundKind.REMOVE_STATE, sent.get(1).kind());

        assertTrue(store.createOrUpdateState("a.b", "Label", "0"));
        assertEquals(OutboundKind.CREATE_STATE, sent.get(2).kind());
    }

    @Test
    void valueIsRecordedEvenWhenWriteIsDropped() {
        store.createOrUpdateState("a.b", "Label", "0");
        connected = false;

        store.updateValue("a.b", "5");

        assertEquals("5", store.value("a.b").orElseThrow());
    }

    @Test
    void resendAllBypassesSuppression() {
        store.createOrUpdateState("a.b", "Label", "0");
        store.declare("c.d", "Other", "x");
        sent.clear();

        assertEquals(2, store.resendAll());

        assertEquals(List.of(
                OutboundMessage.stateUpdate("a.b", "0"),
                OutboundMessage.stateUpdate("c.d", "x")), sent);
    }

    @Test
    void settingUpdatesAreSuppressedAgainstRecordedValues() {
        store.recordSetting("Host", "localhost");

        assertTrue(sent.isEmpty());
        assertFalse(store.updateSetting("Host", "localhost"));
        assertTrue(store.updateSetting("Host", "remote"));

        assertEquals(List.of(OutboundMessage.settingUpdate("Host", "remote")), sent);
        assertEquals("remote", store.setting("Host").orElseThrow());
        assertEquals(1, store.settings().size());
    }

    @Test
    void holdStatusIsTrackedPerInstance() {
        assertFalse(store.isHeld("act"));

        store.setHeld("act", "i1", true);
        store.setHeld("act", "i2", true);
        assertTrue(store.isHeld("act"));
        assertTrue(store.isHeld("act", "i1"));

        store.setHeld("act", "i1", false);
        assertFalse(store.isHeld("act", "i1"));
        assertTrue(store.isHeld("act"));

        store.setHeld("act", "i2", false);
        assertFalse(store.isHeld("act"));
    }

    @Test
    void clearHeldReleasesEverything() {
        store.setHeld("act", "", true);
        store.setHeld("other", "x", true);

        store.clearHeld();

        assertFalse(store.isHeld("act"));
        assertFalse(store.isHeld("other", "x"));
    }

    @Test
    void concurrentWritersNeverSendTheSameValueTwiceInARow() throws Exception {
        store.createOrUpdateState("a.b", "Label", "0");
        sent.clear();

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < threads; t++) {
                int offset = t;
                pool.execute(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    for (int i = 0; i < 2_000; i++) {
                        store.updateValue("a.b", Integer.toString((i + offset) % 3));
                    }
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
        }

        List<OutboundMessage> snapshot = new ArrayList<>(sent);
        assertFalse(snapshot.isEmpty());
        Object previous = "0";
        for (OutboundMessage m : snapshot) {
            assertNotEquals(previous, m.get("value"));
            previous = m.get("value");
        }
        assertEquals(previous, store.value("a.b").orElseThrow());
    }
}
