package com.tripdispatch.shared.enums;

import java.util.Locale;

/**
 * Party acting on a trip: who cancelled it, who rated whom.
 */
public enum TripActor {
    RIDER,
    DRIVER,
    SYSTEM;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
