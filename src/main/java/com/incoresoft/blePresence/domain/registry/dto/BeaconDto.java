package com.incoresoft.blePresence.domain.registry.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tracked beacon keyed by its MAC under {@code beacons} in the data file.
 * Detections are keyed by receiver id, so a pair can only be stored once.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BeaconDto {
    @JsonProperty("name")
    private String name;
    @JsonProperty("first_seen")
    private Long firstSeen;
    @JsonProperty("detections")
    private Map<String, DetectionDto> detections = new LinkedHashMap<>();

    public BeaconDto(String name, Long firstSeen) {
        this(name, firstSeen, new LinkedHashMap<>());
    }

    public BeaconDto copy() {
        Map<String, DetectionDto> copied = new LinkedHashMap<>();
        if (detections != null) {
            detections.forEach((receiverId, d) -> copied.put(receiverId, d.copy()));
        }
        return new BeaconDto(name, firstSeen, copied);
    }
}
