package com.rms.possync.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Strips credentials from staff payloads before they leave the device.
 *
 * <p>Never mutates its input.</p>
 */
public final class StaffRedactor {

    public static final String PIN_MASK = "****";

    static final String PIN = "pin";
    static final String PIN_HASH = "pinHash";

    private StaffRedactor() {
    }

    /** Full staff record: {@code pin} masked, {@code pinHash} dropped. */
    public static JsonNode redact(JsonNode staff) {
        if (staff == null || !staff.isObject()) {
            return staff;
        }
        ObjectNode copy = ((ObjectNode) staff).deepCopy();
        copy.put(PIN, PIN_MASK);
        copy.remove(PIN_HASH);
        return copy;
    }

    public static List<JsonNode> redactAll(List<JsonNode> staff) {
        if (staff == null) {
            return List.of();
        }
        return staff.stream().map(StaffRedactor::redact).collect(Collectors.toList());
    }

    /** Partial update: both credential fields dropped so peers keep their own values. */
    public static JsonNode redactUpdate(JsonNode updates) {
        if (updates == null || !updates.isObject()) {
            return updates;
        }
        ObjectNode copy = ((ObjectNode) updates).deepCopy();
        copy.remove(PIN);
        copy.remove(PIN_HASH);
        return copy;
    }
}
