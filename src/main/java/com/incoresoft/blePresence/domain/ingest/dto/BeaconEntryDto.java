package com.incoresoft.blePresence.domain.ingest.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BeaconEntryDto {
    @JsonProperty("mac")
    private String mac;
    @JsonProperty("name")
    private String name;
    /** Either a bare number or {"average": .., "current": ..}. */
    @JsonProperty("rssi")
    @JsonDeserialize(using = SignalStrengthDeserializer.class)
    private SignalStrength rssi;
    @JsonProperty("online")
    private Boolean online;
}
