package com.rms.possync.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which transport(s) currently carry sync traffic for this device.
 *
 * <p>Always derived from the two {@link ConnectionState}s, never stored on its own.</p>
 */
public enum SyncPath {

    none,

    cloud,

    lan,

    both;

    @JsonValue
    public String wire() {
        return name();
    }
}
