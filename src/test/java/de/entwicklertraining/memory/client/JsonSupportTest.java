package de.entwicklertraining.memory.client;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JsonSupportTest {

    enum Color { RED }

    record Tagged(String name, Color color, Optional<String> note) {
    }

    @Test
    void testSerializeNestedStructures() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("list", List.of(1, 2));
        value.put("array", new int[]{3, 4});
        value.put("record", new Tagged("x", Color.RED, Optional.empty()));
        value.put("none", null);

        JSONObject json = new JSONObject(JsonSupport.serialize(value));

        assertEquals(2, json.getJSONArray("list").length());
        assertEquals(4, json.getJSONArray("array").getInt(1));
        assertEquals("RED", json.getJSONObject("record").getString("color"));
        assertTrue(json.getJSONObject("record").isNull("note"));
        assertTrue(json.isNull("none"));
    }

    @Test
    void testSerializeScalars() {
        assertEquals("\"text\"", JsonSupport.serialize("text"));
        assertEquals("42", JsonSupport.serialize(42));
        assertEquals("null", JsonSupport.serialize(null));
    }

    @Test
    void testSharedButAcyclicReferencesAreAllowed() {
        List<String> shared = List.of("a");
        Map<String, Object> value = Map.of("first", shared, "second", shared);

        assertDoesNotThrow(() -> JsonSupport.serialize(value));
    }

    @Test
    void testCycleRejected() {
        Map<String, Object> cyclic = new HashMap<>();
        cyclic.put("self", cyclic);

        assertThrows(JSONException.class, () -> JsonSupport.serialize(cyclic));
    }

    @Test
    void testParseStrictAcceptsJsonValues() {
        assertInstanceOf(JSONObject.class, JsonSupport.parseStrict("{\"key\":\"a\"}"));
        assertInstanceOf(JSONArray.class, JsonSupport.parseStrict(" [1,2] "));
        assertEquals("s", JsonSupport.parseStrict("\"s\""));
        assertEquals(Boolean.TRUE, JsonSupport.parseStrict("true"));
        assertEquals(JSONObject.NULL, JsonSupport.parseStrict("null"));
    }

    @Test
    void testParseStrictRejectsMalformedText() {
        for (String text : List.of("", "{", "{\"key\":", "not json", "{\"a\":1} trailing", "'quoted'", "[1,2]]",
                "{key:\"a\"}", "{\"key\": abc}", "{\"key\":\"a\",}", "[1,2,]", "[01]", "{'key':\"a\"}",
                "{\"key\":\"a\" /* note */}", "[\"\\x\"]", "[1.]", "[-]", "[\"tab\there\"]")) {
            assertThrows(JSONException.class, () -> JsonSupport.parseStrict(text), text);
        }
    }

    @Test
    void testParseStrictAcceptsNestedValues() {
        Object value = JsonSupport.parseStrict("{\"a\":[1,-0.5e+3,true,null,{}],\"b\":\"\\u00e4\\n\\/\"}");

        JSONObject object = assertInstanceOf(JSONObject.class, value);
        assertEquals(5, object.getJSONArray("a").length());
        assertEquals("\u00e4\n/", object.getString("b"));
    }

    @Test
    void testParseStrictRejectsExcessiveNesting() {
        String deep = "[".repeat(StrictJsonValidator.MAX_DEPTH + 1) + "]".repeat(StrictJsonValidator.MAX_DEPTH + 1);

        assertThrows(JSONException.class, () -> JsonSupport.parseStrict(deep));
    }
}
