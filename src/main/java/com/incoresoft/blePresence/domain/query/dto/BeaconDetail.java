package com.incoresoft.blePresence.domain.query.dto;

import java.util.List;

/**
 * Every detection of one beacon, recent ones first.
 *
 * @param recentStats signal stats over recent detections, null when none is recent
 */
public record BeaconDetail(String mac, String name, Long firstSeen, List<Line> detections, RssiStats recentStats) {

    /**
     * @param lastSeen resolved detection time, 0 when it cannot be resolved
     * @param recent   seen within the active window
     */
    public record Line(String receiverId, String receiverName, int rssi, boolean online,
                       long lastSeen, long ageMillis, boolean recent) {
    }
}
