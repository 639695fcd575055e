package com.incoresoft.blePresence.domain.query.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.incoresoft.blePresence.domain.presence.dto.RankedReceiver;

import java.util.List;

/** Fresh receivers of one beacon, strongest first. */
public record BeaconReceivers(
        @JsonProperty("beaconId") String beaconId,
        @JsonProperty("beaconMac") String beaconMac,
        @JsonProperty("displayName") String displayName,
        @JsonProperty("receivers") List<RankedReceiver> receivers,
        @JsonProperty("timestamp") long timestamp) {
}
