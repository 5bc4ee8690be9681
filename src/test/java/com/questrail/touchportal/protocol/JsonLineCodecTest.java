package com.questrail.touchportal.protocol;

import com.questrail.touchportal.api.MessageKind;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonLineCodecTest {

    private final JsonLineCodec codec = new JsonLineCodec();

    @Test
    void decodesKnownKinds() {
        InboundMessage m = codec.decode("{\"type\":\"action\",\"pluginId\":\"p\",\"actionId\":\"a\"}");

        assertEquals(MessageKind.ACTION, m.kind());
        assertEquals("a", m.actionId().orElseThrow());
    }

    @Test
    void legacyAliasesResolveToTheirKind() {
        assertEquals(MessageKind.INFO, codec.decode("{\"type\":\"pair\"}").kind());
        assertEquals(MessageKind.HOLD_DOWN, codec.decode("{\"type\":\"on\"}").kind());
        assertEquals(MessageKind.HOLD_UP, codec.decode("{\"type\":\"off\"}").kind());
    }

    @Test
    void unknownTypeDecodesAsUnknown() {
        InboundMessage m = codec.decode("{\"type\":\"somethingNew\",\"x\":1}");

        assertEquals(MessageKind.UNKNOWN, m.kind());
        assertEquals("somethingNew", m.type());
        assertEquals("1", m.text("x").orElseThrow());
    }

    @Test
    void rejectsInvalidJson() {
        assertThrows(ProtocolDecodeException.class, () -> codec.decode("{\"type\":"));
    }

    @Test
    void rejectsTrailingGarbage() {
        assertThrows(ProtocolDecodeException.class, () -> codec.decode("{\"type\":\"action\"} extra"));
    }

    @Test
    void rejectsNonObjects() {
        assertThrows(ProtocolDecodeException.class, () -> codec.decode("[1,2]"));
        assertThrows(ProtocolDecodeException.class, () -> codec.decode(""));
    }

    @Test
    void rejectsMissingOrNonTextualType() {
        assertThrows(ProtocolDecodeException.class, () -> codec.decode("{\"id\":\"x\"}"));
        assertThrows(ProtocolDecodeException.class, () -> codec.decode("{\"type\":3}"));
    }

    @Test
    void encodesCompactLineWithTerminator() {
        byte[] line = codec.encode(OutboundMessage.stateUpdate("a.b", "café"));

        assertEquals("{\"type\":\"stateUpdate\",\"id\":\"a.b\",\"value\":\"café\"}\n",
                new String(line, StandardCharsets.UTF_8));
    }

    @Test
    void encodesNestedValues() {
        String json = codec.encodeToString(OutboundMessage.choiceUpdate("c", List.of("x", "y")));

        assertEquals("{\"type\":\"choiceUpdate\",\"id\":\"c\",\"value\":[\"x\",\"y\"]}", json);
    }
}
