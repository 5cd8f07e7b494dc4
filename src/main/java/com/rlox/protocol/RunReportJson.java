package com.rlox.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rlox.script.parser.Diagnostic;
import com.rlox.script.parser.RunResult;
import com.rlox.script.parser.RuntimeError;
import com.rlox.script.parser.Value;

import java.util.Map;

/**
 * JSON view of a {@link RunResult} for whatever layer reports errors or picks exit codes:
 *
 * <pre>
 * {"ok":false,
 *  "diagnostics":[{"stage":"syntax","line":1,"where":" at 'print'","message":"Expect ';' after value."}],
 *  "runtimeError":null,
 *  "globals":{"x":10.0}}
 * </pre>
 */
public final class RunReportJson {

    private final ObjectMapper om;

    public RunReportJson() {
        this(new ObjectMapper());
    }

    public RunReportJson(ObjectMapper om) {
        this.om = (om == null) ? new ObjectMapper() : om;
    }

    public ObjectNode toJson(RunResult result) {
        if (result == null) throw new IllegalArgumentException("result must not be null");

        ObjectNode root = om.createObjectNode();
        root.put("ok", result.ok());

        ArrayNode diags = root.putArray("diagnostics");
        for (Diagnostic d : result.diagnostics()) {
            ObjectNode n = diags.addObject();
            n.put("stage", d.stage().display());
            n.put("line", d.line());
            n.put("where", d.where());
            n.put("message", d.message());
        }

        RuntimeError err = result.runtimeError();
        if (err == null) {
            root.putNull("runtimeError");
        } else {
            ObjectNode n = root.putObject("runtimeError");
            n.put("kind", err.kind().name());
            n.put("line", err.line());
            n.put("message", err.getMessage());
        }

        ObjectNode globals = root.putObject("globals");
        for (Map.Entry<String, Value> e : result.env().entrySet()) {
            putValue(globals, e.getKey(), e.getValue());
        }
        return root;
    }

    public String toJsonString(RunResult result) {
        try {
            return om.writeValueAsString(toJson(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode run report: " + e.getOriginalMessage(), e);
        }
    }

    private static void putValue(ObjectNode into, String key, Value v) {
        switch (v.getType()) {
            case NIL:
                into.putNull(key);
                break;
            case BOOL:
                into.put(key, v.asBool());
                break;
            case NUMBER: {
                double d = v.asNumber();
                // JSON has no NaN or Infinity
                if (Double.isFinite(d)) into.put(key, d);
                else into.put(key, v.display());
                break;
            }
            case STRING:
                into.put(key, v.asString());
                break;
        }
    }
}
