package com.ryuqq.runcontrol.adapter.file;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.ryuqq.runcontrol.core.statemachine.RunStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * On-disk JSON form of one run.
 *
 * <pre>
 * {
 *   "status": "RUNNING",
 *   "flags": { "paused": true, "cancelled": false },
 *   "metadata": { "created_at": "2024-01-01T00:00:00Z" }
 * }
 * </pre>
 *
 * <p>Immutable. Every mutation returns a copy.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
record RunDocument(
    RunStatus status,
    Map<String, Boolean> flags,
    Map<String, String> metadata
) {

    RunDocument {
        flags = flags == null ? Map.of() : Map.copyOf(flags);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    static RunDocument empty() {
        return new RunDocument(null, Map.of(), Map.of());
    }

    RunDocument withStatus(RunStatus next) {
        return new RunDocument(next, flags, metadata);
    }

    RunDocument withFlag(String name, boolean value) {
        Map<String, Boolean> copy = new LinkedHashMap<>(flags);
        copy.put(name, value);
        return new RunDocument(status, copy, metadata);
    }

    RunDocument withMetadata(String key, String value) {
        Map<String, String> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new RunDocument(status, flags, copy);
    }
}
