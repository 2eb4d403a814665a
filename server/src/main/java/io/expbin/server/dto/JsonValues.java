package io.expbin.server.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.expbin.core.BinValidationException;
import io.expbin.core.BinValue;

import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON <-> BinValue mapping used by the HTTP layer.
 *
 *   null            <-> nil
 *   true/false      <-> bool
 *   integral number <-> long   (must fit in 64 bits)
 *   other number    <-> double
 *   string          <-> string
 *   array           <-> list
 *   object          <-> map
 *   {"$bytes": b64} <-> bytes
 *
 * "$bytes" is reserved: a JSON object using it as a key must be exactly
 * {"$bytes": "<base64>"}, so no map holding that key arrives over HTTP. A map
 * stored through the Java API with "$bytes" as its only key reads back as bytes.
 */
public final class JsonValues {
    public static final String BYTES_KEY = "$bytes";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonValues() {
        // utility
    }

    public static BinValue toBinValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return BinValue.nil();
        }
        if (node.isBoolean()) {
            return BinValue.of(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            if (!node.canConvertToLong()) {
                throw new BinValidationException("integer out of 64-bit range: " + node.asText());
            }
            return BinValue.of(node.longValue());
        }
        if (node.isNumber()) {
            return BinValue.of(node.doubleValue());
        }
        if (node.isTextual()) {
            return BinValue.of(node.textValue());
        }
        if (node.isArray()) {
            List<BinValue> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                items.add(toBinValue(item));
            }
            return BinValue.of(items);
        }
        if (node.isObject()) {
            if (node.has(BYTES_KEY)) {
                JsonNode b64 = node.get(BYTES_KEY);
                if (node.size() != 1 || !b64.isTextual()) {
                    throw new BinValidationException("\"" + BYTES_KEY + "\" is reserved for {\"" + BYTES_KEY + "\": \"<base64>\"}");
                }
                return fromBase64(b64.textValue());
            }
            Map<String, BinValue> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                entries.put(e.getKey(), toBinValue(e.getValue()));
            }
            return BinValue.of(entries);
        }
        throw new BinValidationException("unsupported JSON value: " + node.getNodeType());
    }

    public static BinValue fromBase64(String base64) {
        try {
            return BinValue.of(Base64.getDecoder().decode(base64));
        } catch (IllegalArgumentException e) {
            throw new BinValidationException("valueBase64 must be Base64");
        }
    }

    public static JsonNode toJson(BinValue value) {
        if (value instanceof BinValue.NilValue) {
            return NODES.nullNode();
        }
        if (value instanceof BinValue.BoolValue b) {
            return NODES.booleanNode(b.value());
        }
        if (value instanceof BinValue.LongValue l) {
            return NODES.numberNode(l.value());
        }
        if (value instanceof BinValue.DoubleValue d) {
            return NODES.numberNode(d.value());
        }
        if (value instanceof BinValue.StringValue s) {
            return NODES.textNode(s.value());
        }
        if (value instanceof BinValue.BytesValue bytes) {
            ObjectNode node = NODES.objectNode();
            node.put(BYTES_KEY, Base64.getEncoder().encodeToString(bytes.value()));
            return node;
        }
        if (value instanceof BinValue.ListValue list) {
            ArrayNode node = NODES.arrayNode();
            list.values().forEach(v -> node.add(toJson(v)));
            return node;
        }
        BinValue.MapValue map = (BinValue.MapValue) value;
        ObjectNode node = NODES.objectNode();
        map.entries().forEach((k, v) -> node.set(k, toJson(v)));
        return node;
    }

    public static Map<String, JsonNode> toJson(Map<String, BinValue> bins) {
        Map<String, JsonNode> out = new LinkedHashMap<>();
        bins.forEach((k, v) -> out.put(k, toJson(v)));
        return out;
    }
}
