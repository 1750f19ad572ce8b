import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;

import com.ramlang.script.RamModule;
import com.ramlang.script.RamScript;
import com.ramlang.script.json.AstJsonWriter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RamAstJsonTest {

    private static final ObjectMapper om = new ObjectMapper();

    @Test
    void writesStatementsAndExpressions() {
        RamModule module = new RamScript().parse(String.join("\n",
                "set integer x to 2",
                "new function add takes (a, b) {",
                "    send back a + b",
                "}",
                "if x is 2 {",
                "    call add(x, 1)",
                "} else {",
                "    display not true",
                "}"));

        ArrayNode tree = new AstJsonWriter().write(module);
        assertEquals(3, tree.size());

        JsonNode assign = tree.get(0);
        assertEquals("Assign", assign.get("node").asText());
        assertEquals("integer", assign.get("type").asText());
        assertEquals(2.0, assign.path("value").get("value").asDouble());

        JsonNode fn = tree.get(1);
        assertEquals("Function", fn.get("node").asText());
        assertEquals("b", fn.get("params").get(1).asText());
        assertEquals("+", fn.path("returns").get("op").asText());
        assertEquals(0, fn.get("body").size());

        JsonNode ifNode = tree.get(2);
        JsonNode cond = ifNode.get("branches").get(0).get("condition");
        assertEquals("is", cond.get("op").asText());
        JsonNode call = ifNode.get("branches").get(0).get("body").get(0);
        assertEquals("CallStmt", call.get("node").asText());
        assertEquals(2, call.path("call").get("args").size());
        assertEquals("Unary", ifNode.get("else").get(0).path("value").get("node").asText());
    }

    @Test
    void toJsonIsParseableAndEmptyReturnsAreMarked() throws Exception {
        RamModule module = new RamScript().parse(String.join("\n",
                "new function hello takes () {",
                "    display \"hi\"",
                "}"));

        String json = new AstJsonWriter().toJson(module, true);
        JsonNode back = om.readTree(json);

        assertEquals("Empty", back.get(0).path("returns").get("node").asText());
        assertTrue(json.contains("\n"));
        assertFalse(new AstJsonWriter().toJson(module, false).contains("\n"));
    }
}
