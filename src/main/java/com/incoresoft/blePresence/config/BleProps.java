package com.incoresoft.blePresence.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

/**
 * Tracking settings. Read from the {@code ble} block in application.yml.
 */
@Data
@ConfigurationProperties(prefix = "ble")
public class BleProps {
    /** JSON document holding receivers and beacons. */
    private String dataFile = "data/blues/ble_data.json";
    /** Max age (ms) of a detection that is still shown as a valid receiver. */
    private long freshnessMillis = 15_000L;
    /** Max age (ms) of a detection / receiver report that counts as currently active. */
    private long activeWindowMillis = 10_000L;
    /** Max age (minutes) before the reaper drops receivers, detections and beacons. */
    private long retentionMinutes = 30L;
    /** Local timezone for legacy "last_update" strings and formatted times. Empty means system default. */
    private String timezone;
    /** Beacons whose name starts with this prefix get a numbered display name. */
    private String taggedPrefix = "ESP-C3-";
    /** Key expected in X-Api-Key for the reset endpoint. Empty disables reset over HTTP. */
    private String adminApiKey;

    private Reaper reaper = new Reaper();
    private Report report = new Report();

    @Data
    public static class Reaper {
        private boolean enabled = true;
        private long intervalMinutes = 30L;
    }

    @Data
    public static class Report {
        /** Folder for generated XLSX files. */
        private String outputDir = "data/blues/reports";
    }

    public long retentionMillis() {
        return retentionMinutes * 60_000L;
    }

    public ZoneId zoneId() {
        return (timezone == null || timezone.isBlank()) ? ZoneId.systemDefault() : ZoneId.of(timezone);
    }
}
