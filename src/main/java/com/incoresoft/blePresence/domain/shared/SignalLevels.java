package com.incoresoft.blePresence.domain.shared;

/** RSSI constants shared by ingestion and ranking. */
public final class SignalLevels {
    /** Used wherever a signal strength is missing. */
    public static final int FLOOR = -100;

    private SignalLevels() {
    }

    public static int orFloor(Integer rssi) {
        return rssi == null ? FLOOR : rssi;
    }
}
