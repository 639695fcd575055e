package com.incoresoft.blePresence.domain.query.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.incoresoft.blePresence.domain.presence.dto.RankedReceiver;

import java.util.List;

public record TaggedBeacon(
        @JsonProperty("mac") String mac,
        @JsonProperty("name") String name,
        @JsonProperty("displayName") String displayName,
        @JsonProperty("receivers") List<RankedReceiver> receivers,
        @JsonProperty("first_seen") Long firstSeen) {

    public int strongestRssi() {
        return receivers.isEmpty() ? Integer.MIN_VALUE : receivers.get(0).rssi();
    }
}
