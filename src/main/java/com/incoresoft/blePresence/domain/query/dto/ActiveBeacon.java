package com.incoresoft.blePresence.domain.query.dto;

import com.incoresoft.blePresence.domain.presence.dto.RankedReceiver;

import java.util.List;

/** A beacon with at least one receiver reporting it online inside the active window. */
public record ActiveBeacon(String mac, String name, List<RankedReceiver> receivers) {

    public int strongestRssi() {
        return receivers.get(0).rssi();
    }
}
