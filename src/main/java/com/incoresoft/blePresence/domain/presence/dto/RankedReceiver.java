package com.incoresoft.blePresence.domain.presence.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One receiver currently observing a beacon.
 *
 * @param lastUpdateTime resolved observation time, epoch millis
 * @param lastUpdate     the same time formatted for people
 */
public record RankedReceiver(
        @JsonProperty("receiverId") String receiverId,
        @JsonProperty("receiver") String name,
        @JsonProperty("rssi") int rssi,
        @JsonProperty("online") boolean online,
        @JsonProperty("lastUpdateTime") long lastUpdateTime,
        @JsonProperty("last_update") String lastUpdate) {
}
