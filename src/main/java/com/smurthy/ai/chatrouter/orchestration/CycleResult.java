package com.smurthy.ai.chatrouter.orchestration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the caller gets back from one routing cycle.
 */
public record CycleResult(String sessionId, String response, Map<String, Object> diagnostics) {

    public CycleResult {
        diagnostics = Collections.unmodifiableMap(new LinkedHashMap<>(diagnostics));
    }

    public Object diagnostic(String key) {
        return diagnostics.get(key);
    }

    public boolean hasDiagnostic(String key) {
        return diagnostics.containsKey(key);
    }
}
