import com.fasterxml.jackson.databind.JsonNode;
import com.valyxo.script.ValyxoScript;
import com.valyxo.script.host.ValueJson;
import com.valyxo.script.parser.Value;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ValueJsonTest {

    @Test
    void snapshot_serializesEveryKind() {
        Map<String, Value> vars = new ValyxoScript().run(String.join("\n",
            "set a = [1, 2.5, \"s\", True, None]",
            "set d = {\"k\": \"v\"}",
            "set big = 2 ** 100"
        )).variables();

        assertEquals(
            "{\"a\":[1,2.5,\"s\",true,null],\"d\":{\"k\":\"v\"},\"big\":1267650600228229401496703205376}",
            ValueJson.toJsonString(vars));
    }

    @Test
    void nonFiniteFloats_becomeStrings() {
        JsonNode node = ValueJson.toJson(Value.floating(Double.POSITIVE_INFINITY));
        assertTrue(node.isTextual());
        assertEquals("inf", node.asText());
    }

    @Test
    void fromJson_buildsScriptValues() throws Exception {
        JsonNode node = ValueJson.mapper().readTree("{\"n\":3,\"f\":0.5,\"items\":[true,null,\"x\"]}");

        Value v = ValueJson.fromJson(node);

        Map<String, Value> expected = new LinkedHashMap<>();
        expected.put("n", Value.integer(BigInteger.valueOf(3)));
        expected.put("f", Value.floating(0.5));
        expected.put("items", Value.list(List.of(Value.bool(true), Value.none(), Value.string("x"))));
        assertEquals(Value.dict(expected), v);
    }
}
