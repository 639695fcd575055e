package com.incoresoft.blePresence.domain.query.dto;

/**
 * @param rssi stats over all active detections, null when there are none
 */
public record RegistryStatistics(StatusSummary status, int multiReceiverBeacons, int singleReceiverBeacons,
                                 RssiStats rssi) {
}
