package org.crash.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Message envoyé aux clients : {"action": "...", champ1: ..., champ2: ...}.
 * Les champs sont à plat, au même niveau que "action".
 */
@JsonPropertyOrder({"action"})
public class CrashEvent {
    private final String action;
    private final Map<String, Object> fields = new LinkedHashMap<>();

    private CrashEvent(String action) {
        this.action = action;
    }

    public static CrashEvent of(String action) {
        return new CrashEvent(action);
    }

    public static CrashEvent error(String message) {
        return of("ERROR").with("message", message);
    }

    public CrashEvent with(String name, Object value) {
        fields.put(name, value);
        return this;
    }

    public String getAction() {
        return action;
    }

    public Object get(String name) {
        return fields.get(name);
    }

    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    @Override
    public String toString() {
        return "CrashEvent{" + action + ", " + fields + "}";
    }
}
