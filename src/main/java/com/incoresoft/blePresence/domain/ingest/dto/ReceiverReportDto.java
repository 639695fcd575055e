package com.incoresoft.blePresence.domain.ingest.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One scan report pushed by a receiver ({@code device.ble_beacon_batch} event).
 * Large scans arrive split into numbered batches.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReceiverReportDto {
    @JsonProperty("device_id")
    private String deviceId;
    @JsonProperty("device_name")
    private String deviceName;
    @JsonProperty("device_type")
    private String deviceType;
    @JsonProperty("event_data")
    private EventData eventData;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EventData {
        @JsonProperty("data_type")
        private String dataType;
        @JsonProperty("batch")
        private Integer batch;
        @JsonProperty("total_batches")
        private Integer totalBatches;
        @JsonProperty("beacons")
        private List<BeaconEntryDto> beacons = new ArrayList<>();
    }
}
