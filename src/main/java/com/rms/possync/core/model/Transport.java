package com.rms.possync.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The two independent sync transports. Used to tag errors and inbound message sources.
 */
public enum Transport {

    cloud,

    lan;

    @JsonValue
    public String wire() {
        return name();
    }
}
