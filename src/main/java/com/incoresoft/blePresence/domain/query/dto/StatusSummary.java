package com.incoresoft.blePresence.domain.query.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StatusSummary(
        @JsonProperty("receivers") Counts receivers,
        @JsonProperty("beacons") Counts beacons,
        @JsonProperty("active_window") long activeWindowMillis,
        @JsonProperty("timestamp") long timestamp) {

    public record Counts(int total, int active) {
    }

    public int receiverTotal() {
        return receivers.total();
    }

    public int receiverActive() {
        return receivers.active();
    }

    public int objectTotal() {
        return beacons.total();
    }

    public int objectActive() {
        return beacons.active();
    }
}
