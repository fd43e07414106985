package com.rms.possync.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Connection state of a single transport (cloud or LAN), and of the aggregate.
 *
 * <p>Lower-case constants match the tokens shown to UI consumers and emitted in
 * the admin status payload.</p>
 */
public enum ConnectionState {

    disconnected,

    connecting,

    connected;

    @JsonValue
    public String wire() {
        return name();
    }
}
