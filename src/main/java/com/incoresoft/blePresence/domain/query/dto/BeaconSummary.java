package com.incoresoft.blePresence.domain.query.dto;

/**
 * One line of the full beacon list.
 *
 * @param strongestRssi strongest active rssi, -100 when nothing is active
 * @param newestUpdate  newest detection time of any age, 0 when none resolves
 */
public record BeaconSummary(String mac, String name, int activeReceivers, int strongestRssi,
                            long newestUpdate, boolean active) {
}
