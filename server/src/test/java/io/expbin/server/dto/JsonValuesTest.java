package io.expbin.server.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.expbin.core.BinValidationException;
import io.expbin.core.BinValue;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonValuesTest {

    private final ObjectMapper json = new ObjectMapper();

    private BinValue parse(String text) throws Exception {
        return JsonValues.toBinValue(json.readTree(text));
    }

    @Test
    void scalars_map_to_their_variants() throws Exception {
        assertEquals(BinValue.nil(), parse("null"));
        assertEquals(BinValue.of(true), parse("true"));
        assertEquals(BinValue.of(42L), parse("42"));
        assertEquals(BinValue.of(1.5), parse("1.5"));
        assertEquals(BinValue.of("hi"), parse("\"hi\""));
    }

    @Test
    void nested_values_keep_structure_and_order() throws Exception {
        BinValue v = parse("{\"b\":[1,\"x\"],\"a\":{\"$bytes\":\"AQI=\"}}");

        var map = (BinValue.MapValue) v;
        assertEquals(List.of("b", "a"), List.copyOf(map.entries().keySet()));
        assertEquals(BinValue.of(List.of(BinValue.of(1L), BinValue.of("x"))), map.entries().get("b"));
        assertEquals(BinValue.of(new byte[]{1, 2}), map.entries().get("a"));
    }

    @Test
    void bytes_are_written_as_tagged_object() {
        JsonNode node = JsonValues.toJson(BinValue.of(new byte[]{1, 2, 3}));
        assertEquals("AQID", node.get(JsonValues.BYTES_KEY).asText());

        JsonNode map = JsonValues.toJson(BinValue.of(Map.of("n", BinValue.nil())));
        assertTrue(map.get("n").isNull());
    }

    @Test
    void out_of_range_integers_and_bad_base64_are_rejected() {
        assertThrows(BinValidationException.class, () -> parse("123456789012345678901234567890"));
        assertThrows(BinValidationException.class, () -> JsonValues.fromBase64("***"));
    }

    @Test
    void bytes_key_is_reserved_in_objects() {
        assertThrows(BinValidationException.class, () -> parse("{\"$bytes\":\"AQI=\",\"x\":1}"));
        assertThrows(BinValidationException.class, () -> parse("{\"$bytes\":12}"));
        assertThrows(BinValidationException.class, () -> parse("{\"$bytes\":\"not-b64!\"}"));
        assertEquals(BinValue.of(Map.of("bytes", BinValue.of("x"))), assertDoesNotThrow(() -> parse("{\"bytes\":\"x\"}")));
    }
}
