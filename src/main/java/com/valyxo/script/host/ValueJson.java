package com.valyxo.script.host;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.valyxo.script.parser.Value;

/**
 * Script values to and from Jackson trees.
 *
 * int -> integral number, float -> double (nan/inf as strings), str -> string, bool -> boolean,
 * list -> array, dict -> object, None -> null.
 */
public final class ValueJson {
    private static final ObjectMapper om = new ObjectMapper();
    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private ValueJson() {}

    public static ObjectMapper mapper() {
        return om;
    }

    public static JsonNode toJson(Value v) {
        switch (v.type) {
            case INT: {
                BigInteger n = v.asInteger();
                return n.bitLength() < 64 ? nodes.numberNode(n.longValue()) : nodes.numberNode(n);
            }
            case FLOAT: {
                double d = v.asFloat();
                if (Double.isNaN(d) || Double.isInfinite(d)) return nodes.textNode(v.display());
                return nodes.numberNode(d);
            }
            case STRING:
                return nodes.textNode(v.asString());
            case BOOL:
                return nodes.booleanNode(v.asBool());
            case LIST: {
                ArrayNode arr = nodes.arrayNode();
                for (Value item : v.asList()) arr.add(toJson(item));
                return arr;
            }
            case DICT:
                return toJson(v.asDict());
            default:
                return nodes.nullNode();
        }
    }

    /** A variable snapshot as one JSON object, keys in snapshot order. */
    public static ObjectNode toJson(Map<String, Value> variables) {
        ObjectNode obj = nodes.objectNode();
        for (Map.Entry<String, Value> e : variables.entrySet()) {
            obj.set(e.getKey(), toJson(e.getValue()));
        }
        return obj;
    }

    public static String toJsonString(Map<String, Value> variables) {
        return write(toJson(variables));
    }

    static String write(JsonNode node) {
        try {
            return om.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * JSON back to a script value. Integral numbers become ints, other numbers floats.
     *
     * @throws IllegalArgumentException for node kinds with no script counterpart (binary, POJO)
     */
    public static Value fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return Value.none();
        if (node.isIntegralNumber()) return Value.integer(node.bigIntegerValue());
        if (node.isNumber()) return Value.floating(node.doubleValue());
        if (node.isTextual()) return Value.string(node.textValue());
        if (node.isBoolean()) return Value.bool(node.booleanValue());
        if (node.isArray()) {
            List<Value> items = new ArrayList<>(node.size());
            for (JsonNode item : node) items.add(fromJson(item));
            return Value.list(items);
        }
        if (node.isObject()) {
            Map<String, Value> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                entries.put(e.getKey(), fromJson(e.getValue()));
            }
            return Value.dict(entries);
        }
        throw new IllegalArgumentException("Unsupported JSON node: " + node.getNodeType());
    }
}
