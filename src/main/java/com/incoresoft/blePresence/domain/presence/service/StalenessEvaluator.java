package com.incoresoft.blePresence.domain.presence.service;

import com.incoresoft.blePresence.config.BleProps;
import com.incoresoft.blePresence.domain.registry.dto.DetectionDto;
import com.incoresoft.blePresence.domain.registry.dto.ReceiverDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.OptionalLong;

/**
 * Age checks for detections and receivers.
 * <p>
 * Two thresholds are in play and stay separate: {@code freshnessMillis} decides whether a
 * detection is shown as a valid receiver, {@code activeWindowMillis} decides whether it
 * counts as currently active. Both compare inclusively ({@code age <= threshold}).
 * A detection whose time cannot be resolved is always stale.
 */
@Slf4j
@Component
public class StalenessEvaluator {
    /** Local time written by older producers, e.g. "2025/11/7 20:32:24". */
    private static final DateTimeFormatter LEGACY_LOCAL = DateTimeFormatter.ofPattern("uuuu/M/d H:m:s");
    private static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("uuuu/M/d HH:mm:ss");

    private final BleProps props;
    private final ZoneId zone;

    public StalenessEvaluator(BleProps props) {
        this.props = props;
        this.zone = props.zoneId();
    }

    /**
     * Observation time of a detection: {@code update_time} when present, else the parsed
     * {@code last_update} string in the configured zone, else empty.
     */
    public OptionalLong resolveTimestamp(DetectionDto detection) {
        if (detection == null) return OptionalLong.empty();
        if (detection.getUpdateTime() != null) return OptionalLong.of(detection.getUpdateTime());
        String legacy = detection.getLastUpdate();
        if (legacy == null || legacy.isBlank()) return OptionalLong.empty();
        try {
            LocalDateTime local = LocalDateTime.parse(legacy.trim(), LEGACY_LOCAL);
            return OptionalLong.of(local.atZone(zone).toInstant().toEpochMilli());
        } catch (DateTimeParseException e) {
            log.debug("Unparsable last_update '{}': {}", legacy, e.getMessage());
            return OptionalLong.empty();
        }
    }

    public boolean isWithin(long timestamp, long now, long threshold) {
        return now - timestamp <= threshold;
    }

    public boolean isFresh(DetectionDto detection, long now, long threshold) {
        OptionalLong ts = resolveTimestamp(detection);
        return ts.isPresent() && isWithin(ts.getAsLong(), now, threshold);
    }

    public boolean isFresh(DetectionDto detection, long now) {
        return isFresh(detection, now, props.getFreshnessMillis());
    }

    /** Receiver-asserted online and seen within the active window. */
    public boolean isActive(DetectionDto detection, long now) {
        return detection != null && detection.reportedOnline()
                && isFresh(detection, now, props.getActiveWindowMillis());
    }

    public boolean isReceiverActive(ReceiverDto receiver, long now) {
        return receiver != null && receiver.getUpdate() != null
                && isWithin(receiver.getUpdate(), now, props.getActiveWindowMillis());
    }

    public String formatTime(long epochMillis) {
        return DISPLAY.format(Instant.ofEpochMilli(epochMillis).atZone(zone));
    }

    public long freshnessMillis() {
        return props.getFreshnessMillis();
    }

    public long activeWindowMillis() {
        return props.getActiveWindowMillis();
    }

    public ZoneId zone() {
        return zone;
    }
}
