package org.calista.formalizer.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class RunEvent {
    public static final String STAGE1_DONE = "STAGE1_DONE";
    public static final String NODE_SYNTHESIZED = "NODE_SYNTHESIZED";
    public static final String NODE_FAILED = "NODE_FAILED";
    public static final String ARTIFACT = "ARTIFACT";
    public static final String ALIGNMENT = "ALIGNMENT";

    public String type;
    public long tsEpochMs;
    public String runId;
    public String nodeId;      // null for run-level events
    public String text;
    public Map<String, Object> data = new LinkedHashMap<>();

    public static RunEvent of(String type, String runId, String nodeId, String text) {
        RunEvent e = new RunEvent();
        e.type = type;
        e.runId = runId;
        e.nodeId = nodeId;
        e.text = text;
        e.tsEpochMs = System.currentTimeMillis();
        return e;
    }

    public RunEvent with(String key, Object value) {
        data.put(key, value);
        return this;
    }
}
