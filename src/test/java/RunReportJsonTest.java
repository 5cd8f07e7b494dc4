import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rlox.debug.Debug;
import com.rlox.protocol.RunReportJson;
import com.rlox.script.RloxScript;
import com.rlox.script.parser.RunResult;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.junit.jupiter.api.Assertions.*;

public class RunReportJsonTest {

    @BeforeEach
    void quietDebug() {
        Debug.get().setSink(null);
    }

    private static RunResult run(String source) {
        RloxScript rs = new RloxScript();
        rs.setOutput(new PrintStream(new ByteArrayOutputStream()));
        return rs.run(source);
    }

    @Test
    void cleanRun_reportsOkAndGlobals() {
        ObjectNode json = new RunReportJson().toJson(
                run("var x = 10; var s = \"text\"; var b = true; var n;"));

        assertTrue(json.get("ok").asBoolean());
        assertEquals(0, json.get("diagnostics").size());
        assertTrue(json.get("runtimeError").isNull());

        JsonNode globals = json.get("globals");
        assertEquals(10.0, globals.get("x").asDouble(), 0.0);
        assertEquals("text", globals.get("s").asText());
        assertTrue(globals.get("b").asBoolean());
        assertTrue(globals.get("n").isNull());
    }

    @Test
    void diagnosticsAndRuntimeError_areSerialized() {
        ObjectNode json = new RunReportJson().toJson(run("var x = 1\nprint 2;\nprint y;"));

        assertFalse(json.get("ok").asBoolean());

        JsonNode diag = json.get("diagnostics").get(0);
        assertEquals("syntax", diag.get("stage").asText());
        assertEquals(2, diag.get("line").asInt());
        assertEquals(" at 'print'", diag.get("where").asText());
        assertEquals("Expect ';' after variable declaration.", diag.get("message").asText());

        assertEquals("runtime", json.get("diagnostics").get(1).get("stage").asText());

        JsonNode err = json.get("runtimeError");
        assertEquals("UNDEFINED_VARIABLE", err.get("kind").asText());
        assertEquals(3, err.get("line").asInt());
        assertEquals("Undefined variable 'y'.", err.get("message").asText());
    }

    @Test
    void nonFiniteNumbers_areWrittenAsDisplayStrings() {
        ObjectNode json = new RunReportJson().toJson(run("var inf = 1 / 0; var nan = 0 / 0;"));

        assertEquals("Infinity", json.get("globals").get("inf").asText());
        assertEquals("NaN", json.get("globals").get("nan").asText());
    }

    @Test
    void toJsonString_isParseableBack() throws Exception {
        String text = new RunReportJson().toJsonString(run("var a = 2;"));
        JsonNode back = new ObjectMapper().readTree(text);

        assertTrue(back.get("ok").asBoolean());
        assertEquals(2.0, back.get("globals").get("a").asDouble(), 0.0);
    }

    @Test
    void largeIntegralNumbers_stayNumeric() {
        ObjectNode json = new RunReportJson().toJson(run("var big = 10000000;"));
        assertEquals(1.0E7, json.get("globals").get("big").asDouble(), 0.0);
        assertTrue(json.get("globals").get("big").isNumber());
    }

    @Test
    void nullResult_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RunReportJson().toJson(null));
    }
}
