package com.questrail.touchportal.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TypeDomainsTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static ObjectNode json(String text) throws Exception {
        return (ObjectNode) MAPPER.readTree(text);
    }

    @Test
    void numberWithinRangeIsAccepted() throws Exception {
        ObjectNode data = json("{\"type\":\"number\",\"default\":50,\"minValue\":0,\"maxValue\":100}");
        assertTrue(TypeDomains.check(EntityKind.ACTION_DATA, data).isEmpty());
    }

    @Test
    void numericTextDefaultIsAccepted() throws Exception {
        ObjectNode data = json("{\"type\":\"number\",\"default\":\"12.5\"}");
        assertTrue(TypeDomains.check(EntityKind.ACTION_DATA, data).isEmpty());
    }

    @Test
    void numberProblemsAreReported() throws Exception {
        List<TypeDomains.Problem> inverted = TypeDomains.check(EntityKind.ACTION_DATA,
                json("{\"type\":\"number\",\"minValue\":10,\"maxValue\":1}"));
        assertEquals(1, inverted.size());
        assertEquals("minValue", inverted.get(0).attribute());

        List<TypeDomains.Problem> outOfRange = TypeDomains.check(EntityKind.ACTION_DATA,
                json("{\"type\":\"number\",\"default\":101,\"minValue\":0,\"maxValue\":100}"));
        assertEquals(1, outOfRange.size());
        assertEquals("default", outOfRange.get(0).attribute());

        List<TypeDomains.Problem> notNumeric = TypeDomains.check(EntityKind.ACTION_DATA,
                json("{\"type\":\"number\",\"default\":\"loud\"}"));
        assertEquals(1, notNumeric.size());
    }

    @Test
    void choiceRequiresValuesAndMemberDefault() throws Exception {
        assertEquals("valueChoices", TypeDomains.check(EntityKind.STATE,
                json("{\"type\":\"choice\",\"default\":\"a\"}")).get(0).attribute());
        assertEquals(1, TypeDomains.check(EntityKind.STATE,
                json("{\"type\":\"choice\",\"valueChoices\":[]}")).size());
        assertEquals("default", TypeDomains.check(EntityKind.STATE,
                json("{\"type\":\"choice\",\"default\":\"c\",\"valueChoices\":[\"a\",\"b\"]}")).get(0).attribute());

        assertTrue(TypeDomains.check(EntityKind.STATE,
                json("{\"type\":\"choice\",\"default\":\"b\",\"valueChoices\":[\"a\",\"b\"]}")).isEmpty());
        assertTrue(TypeDomains.check(EntityKind.STATE,
                json("{\"type\":\"choice\",\"default\":\"\",\"valueChoices\":[\"a\"]}")).isEmpty());
    }

    @Test
    void switchAndColorDefaults() throws Exception {
        assertTrue(TypeDomains.check(EntityKind.ACTION_DATA, json("{\"type\":\"switch\",\"default\":true}")).isEmpty());
        assertTrue(TypeDomains.check(EntityKind.ACTION_DATA, json("{\"type\":\"switch\",\"default\":\"false\"}")).isEmpty());
        assertEquals(1, TypeDomains.check(EntityKind.ACTION_DATA, json("{\"type\":\"switch\",\"default\":\"on\"}")).size());

        assertTrue(TypeDomains.check(EntityKind.ACTION_DATA, json("{\"type\":\"color\",\"default\":\"#FF00AA\"}")).isEmpty());
        assertTrue(TypeDomains.check(EntityKind.ACTION_DATA, json("{\"type\":\"color\",\"default\":\"#ff00aa80\"}")).isEmpty());
        assertEquals(1, TypeDomains.check(EntityKind.ACTION_DATA, json("{\"type\":\"color\",\"default\":\"red\"}")).size());
    }

    @Test
    void kindsWithoutValueDomainsAreNotChecked() throws Exception {
        assertFalse(TypeDomains.appliesTo(EntityKind.ACTION));
        assertTrue(TypeDomains.check(EntityKind.ACTION, json("{\"type\":\"number\",\"default\":\"x\"}")).isEmpty());
    }
}
