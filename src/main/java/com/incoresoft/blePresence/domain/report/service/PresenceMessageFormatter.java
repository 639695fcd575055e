package com.incoresoft.blePresence.domain.report.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.incoresoft.blePresence.domain.presence.dto.RankedReceiver;
import com.incoresoft.blePresence.domain.presence.service.StalenessEvaluator;
import com.incoresoft.blePresence.domain.query.dto.ActiveBeacon;
import com.incoresoft.blePresence.domain.query.dto.BeaconDetail;
import com.incoresoft.blePresence.domain.query.dto.BeaconSummary;
import com.incoresoft.blePresence.domain.query.dto.RegistryStatistics;
import com.incoresoft.blePresence.domain.query.dto.StatusSummary;
import com.incoresoft.blePresence.domain.registry.dto.BeaconDto;
import com.incoresoft.blePresence.domain.registry.dto.RegistryDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Plain-text chat replies for the presence views.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PresenceMessageFormatter {
    static final int MAX_STATUS_BEACONS = 15;
    static final int JSON_LIMIT = 3000;
    static final int JSON_TRUNCATE_AT = 2900;
    private static final String RULE = "═══════════════════════════\n";

    private final StalenessEvaluator staleness;
    private final ObjectMapper objectMapper;

    /** Active beacons with their receivers, strongest first. */
    public String status(List<ActiveBeacon> active, StatusSummary summary, long now) {
        if (summary.objectTotal() == 0) return "No beacon data yet";
        if (active.isEmpty()) {
            return "No active beacons (last " + summary.activeWindowMillis() / 1000 + " s)";
        }
        StringBuilder msg = new StringBuilder("📡 Beacon status\n").append(RULE).append('\n');
        for (ActiveBeacon beacon : active.subList(0, Math.min(active.size(), MAX_STATUS_BEACONS))) {
            msg.append("🔵 ").append(beacon.name()).append('\n');
            msg.append("   MAC: ").append(beacon.mac()).append('\n');
            msg.append("   Seen by ").append(beacon.receivers().size()).append(" receiver(s):\n\n");
            for (int i = 0; i < beacon.receivers().size(); i++) {
                RankedReceiver r = beacon.receivers().get(i);
                msg.append(i == 0 ? "🏆 " : "   ").append(signalLevel(r.rssi())).append(' ')
                        .append(r.name()).append('\n');
                msg.append("      Signal: ").append(r.rssi()).append("dBm | ")
                        .append(secondsAgo(now - r.lastUpdateTime())).append('\n');
            }
            msg.append('\n');
        }
        if (active.size() > MAX_STATUS_BEACONS) {
            msg.append("... and ").append(active.size() - MAX_STATUS_BEACONS).append(" more active beacons\n\n");
        }
        msg.append(RULE);
        msg.append("📊 Active: ").append(summary.receiverActive()).append('/').append(summary.receiverTotal())
                .append(" receivers | ").append(active.size()).append('/').append(summary.objectTotal())
                .append(" beacons\n");
        msg.append("💡 Send /list for the full list");
        return msg.toString();
    }

    public String beaconList(List<BeaconSummary> beacons, long now) {
        if (beacons.isEmpty()) return "No beacon data yet";
        StringBuilder msg = new StringBuilder("📋 All beacons\n").append(RULE).append('\n');
        for (BeaconSummary b : beacons) {
            msg.append(b.active() ? "🟢 active " : "🔴 offline ").append(b.name()).append('\n');
            msg.append("   MAC: ").append(b.mac()).append('\n');
            if (b.active()) {
                msg.append("   Receivers: ").append(b.activeReceivers())
                        .append(" | Strongest: ").append(b.strongestRssi()).append("dBm\n");
            } else {
                msg.append("   Last seen: ").append(minutesAgo(now - b.newestUpdate())).append('\n');
            }
            msg.append('\n');
        }
        msg.append(RULE);
        msg.append("Total: ").append(beacons.size()).append(" beacons\n");
        msg.append("💡 Send /detail <name> for details");
        return msg.toString();
    }

    public String detail(BeaconDetail detail) {
        StringBuilder msg = new StringBuilder("🔍 Beacon details\n").append(RULE).append('\n');
        msg.append("📍 Name: ").append(detail.name()).append('\n');
        msg.append("🔖 MAC: ").append(detail.mac()).append('\n');
        if (detail.firstSeen() != null) {
            msg.append("🕐 First seen: ").append(staleness.formatTime(detail.firstSeen())).append('\n');
        }
        msg.append('\n');
        msg.append("📡 Detections (").append(detail.detections().size()).append(" receivers):\n\n");
        for (BeaconDetail.Line line : detail.detections()) {
            msg.append(line.recent() ? "🟢 online " : "🔴 offline ").append(line.receiverName()).append('\n');
            msg.append("   ID: ").append(line.receiverId()).append('\n');
            msg.append("   Signal: ").append(line.rssi()).append("dBm | ")
                    .append(minutesAgo(line.ageMillis())).append("\n\n");
        }
        if (detail.recentStats() != null) {
            msg.append(RULE);
            msg.append("📊 Current:\n");
            msg.append("   Average: ").append(oneDecimal(detail.recentStats().average())).append("dBm\n");
            msg.append("   Strongest: ").append(detail.recentStats().max()).append("dBm\n");
            msg.append("   Weakest: ").append(detail.recentStats().min()).append("dBm\n");
        }
        return msg.toString();
    }

    public String statistics(RegistryStatistics stats, long now) {
        StatusSummary s = stats.status();
        StringBuilder msg = new StringBuilder("📊 Beacon statistics\n").append(RULE).append('\n');
        msg.append("🔧 Receivers:\n");
        msg.append("   Total: ").append(s.receiverTotal()).append('\n');
        msg.append("   Active: ").append(s.receiverActive()).append("\n\n");
        msg.append("📡 Beacons:\n");
        msg.append("   Total: ").append(s.objectTotal()).append('\n');
        msg.append("   Active: ").append(s.objectActive()).append('\n');
        msg.append("   Seen by several receivers: ").append(stats.multiReceiverBeacons()).append('\n');
        msg.append("   Seen by one receiver: ").append(stats.singleReceiverBeacons()).append("\n\n");
        if (stats.rssi() != null) {
            msg.append("📶 Signal:\n");
            msg.append("   Average: ").append(oneDecimal(stats.rssi().average())).append("dBm\n");
            msg.append("   Strongest: ").append(stats.rssi().max()).append("dBm\n");
            msg.append("   Weakest: ").append(stats.rssi().min()).append("dBm\n");
            msg.append("   Samples: ").append(stats.rssi().samples()).append("\n\n");
        }
        msg.append(RULE);
        msg.append("⏰ Updated: ").append(staleness.formatTime(now));
        return msg.toString();
    }

    /** Compact JSON export, cut short for chat when it is too long. */
    public String json(RegistryDocument document) {
        if (document.isEmpty()) return "No beacon data yet";
        Map<String, Object> beacons = new LinkedHashMap<>();
        for (Map.Entry<String, BeaconDto> e : document.getBeacons().entrySet()) {
            Map<String, Object> detections = new LinkedHashMap<>();
            e.getValue().getDetections().forEach((receiverId, d) -> {
                Map<String, Object> line = new LinkedHashMap<>();
                line.put("receiver", d.displayReceiverName());
                line.put("rssi", d.getRssi());
                line.put("online", d.getOnline());
                line.put("last_update", staleness.resolveTimestamp(d).isPresent()
                        ? staleness.formatTime(staleness.resolveTimestamp(d).getAsLong()) : null);
                detections.put(receiverId, line);
            });
            Map<String, Object> beacon = new LinkedHashMap<>();
            beacon.put("name", e.getValue().getName());
            beacon.put("detections", detections);
            beacons.put(e.getKey(), beacon);
        }
        Map<String, Object> simplified = new LinkedHashMap<>();
        simplified.put("devices", document.getDevices());
        simplified.put("beacons", beacons);

        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(simplified);
        } catch (JsonProcessingException e) {
            log.error("JSON export failed: {}", e.getMessage(), e);
            return "Failed to export JSON: " + e.getMessage();
        }
        return "```json\n" + truncateForChat(json) + "\n```";
    }

    /** Cuts text longer than {@link #JSON_LIMIT}, never between the two halves of a surrogate pair. */
    static String truncateForChat(String text) {
        if (text.length() <= JSON_LIMIT) return text;
        int end = JSON_TRUNCATE_AT;
        if (Character.isHighSurrogate(text.charAt(end - 1))) end--;
        return text.substring(0, end) + "\n... (truncated)";
    }

    static String signalLevel(int rssi) {
        if (rssi >= -60) return "📶strong";
        if (rssi >= -70) return "📶medium";
        if (rssi >= -80) return "📶weak";
        return "📶very weak";
    }

    static String secondsAgo(long ageMillis) {
        long seconds = Math.max(0, ageMillis) / 1000;
        return seconds == 0 ? "just now" : seconds + "s ago";
    }

    static String minutesAgo(long ageMillis) {
        long minutes = Math.max(0, ageMillis) / 60_000;
        if (minutes < 1) return "just now";
        if (minutes < 60) return minutes + " min ago";
        return (minutes / 60) + " h ago";
    }

    private static String oneDecimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
