package com.incoresoft.blePresence.domain.registry.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Whole persisted document: {@code {"devices": {...}, "beacons": {...}}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RegistryDocument {
    @JsonProperty("devices")
    private Map<String, ReceiverDto> devices = new LinkedHashMap<>();
    @JsonProperty("beacons")
    private Map<String, BeaconDto> beacons = new LinkedHashMap<>();

    public static RegistryDocument empty() {
        return new RegistryDocument(new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    /** Replaces missing containers with empty ones, as documents written by hand may omit them. */
    public RegistryDocument normalized() {
        if (devices == null) devices = new LinkedHashMap<>();
        if (beacons == null) beacons = new LinkedHashMap<>();
        beacons.values().removeIf(b -> b == null);
        for (BeaconDto b : beacons.values()) {
            if (b.getDetections() == null) b.setDetections(new LinkedHashMap<>());
            b.getDetections().values().removeIf(d -> d == null);
        }
        devices.values().removeIf(d -> d == null);
        return this;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return (devices == null || devices.isEmpty()) && (beacons == null || beacons.isEmpty());
    }

    public RegistryDocument copy() {
        Map<String, ReceiverDto> d = new LinkedHashMap<>();
        if (devices != null) devices.forEach((id, r) -> d.put(id, r.copy()));
        Map<String, BeaconDto> b = new LinkedHashMap<>();
        if (beacons != null) beacons.forEach((mac, beacon) -> b.put(mac, beacon.copy()));
        return new RegistryDocument(d, b);
    }
}
