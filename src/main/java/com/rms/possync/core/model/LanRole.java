package com.rms.possync.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * LAN role of a service instance. Exactly one holds at any time.
 */
public enum LanRole {

    server,

    client,

    none;

    @JsonValue
    public String wire() {
        return name();
    }
}
