package com.acme.autodoist.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import java.util.Map;
import static org.junit.jupiter.api.Assertions.*;

class JsonsTest {

    @Test
    void testToJson() {
        String json = Jsons.toJson(Map.of("ok", true));
        assertEquals("{\"ok\":true}", json);
    }

    @Test
    void testReadTreeRejectsMalformedInput() {
        assertThrows(JsonProcessingException.class, () -> Jsons.readTree("{not json"));
    }

    @Test
    void testToMapIsLenient() {
        assertTrue(Jsons.toMap(null).isEmpty());
        assertTrue(Jsons.toMap("  ").isEmpty());
        assertTrue(Jsons.toMap("[broken").isEmpty());
        assertEquals(3, Jsons.toMap("{\"rules_triggered\":3}").get("rules_triggered"));
    }

    @Test
    void testAsMap() {
        Map<String, Object> payload = Jsons.asMap(Map.of("message", "hi", "meta", Map.of("n", 1)));
        assertEquals("hi", payload.get("message"));
        assertEquals(Map.of("n", 1), payload.get("meta"));

        assertTrue(Jsons.asMap(null).isEmpty());
        assertTrue(Jsons.asMap("not an object").isEmpty());
        assertTrue(Jsons.asMap(java.util.List.of(1, 2)).isEmpty());
    }

    @Test
    void testMergeOverwrite() {
        Map<String, Object> merged = Jsons.merge(Map.of("a", "1", "b", "2"), Map.of("b", "99", "c", "3"));

        assertEquals(3, merged.size());
        assertEquals("1", merged.get("a"));
        assertEquals("99", merged.get("b")); // second map wins
        assertEquals("3", merged.get("c"));
    }

    @Test
    void testText() throws Exception {
        JsonNode node = Jsons.readTree("{\"id\":123,\"name\":\"x\",\"nil\":null,\"obj\":{}}");
        assertEquals("123", Jsons.text(node, "id"));
        assertEquals("x", Jsons.text(node, "name"));
        assertNull(Jsons.text(node, "nil"));
        assertNull(Jsons.text(node, "obj"));
        assertNull(Jsons.text(node, "missing"));
        assertNull(Jsons.text(null, "id"));
    }
}
