package com.incoresoft.blePresence.domain.presence.service;

import com.incoresoft.blePresence.domain.presence.dto.RankedReceiver;
import com.incoresoft.blePresence.domain.registry.dto.BeaconDto;
import com.incoresoft.blePresence.domain.registry.dto.DetectionDto;
import com.incoresoft.blePresence.domain.shared.SignalLevels;
import com.incoresoft.blePresence.domain.shared.UnicodeEscapes;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.function.BiPredicate;

/**
 * Ranks the receivers of a beacon by signal strength, strongest (closest) first.
 * The sort is stable: equal strengths keep the registry's receiver order.
 */
@Component
@RequiredArgsConstructor
public class PresenceResolver {
    private static final Comparator<RankedReceiver> STRONGEST_FIRST =
            Comparator.comparingInt(RankedReceiver::rssi).reversed();

    private final StalenessEvaluator staleness;

    /** Receivers whose detection passes {@code threshold}; empty when none does. */
    public List<RankedReceiver> rankedReceivers(BeaconDto beacon, long now, long threshold) {
        return rank(beacon, (d, ts) -> staleness.isWithin(ts, now, threshold));
    }

    public List<RankedReceiver> rankedReceivers(BeaconDto beacon, long now) {
        return rankedReceivers(beacon, now, staleness.freshnessMillis());
    }

    /** Receivers that report the beacon online within the active window. */
    public List<RankedReceiver> activeReceivers(BeaconDto beacon, long now) {
        return rank(beacon, (d, ts) -> d.reportedOnline()
                && staleness.isWithin(ts, now, staleness.activeWindowMillis()));
    }

    private List<RankedReceiver> rank(BeaconDto beacon, BiPredicate<DetectionDto, Long> keep) {
        List<RankedReceiver> out = new ArrayList<>();
        if (beacon == null || beacon.getDetections() == null) return out;
        for (Map.Entry<String, DetectionDto> e : beacon.getDetections().entrySet()) {
            DetectionDto d = e.getValue();
            OptionalLong ts = staleness.resolveTimestamp(d);
            if (ts.isEmpty() || !keep.test(d, ts.getAsLong())) continue;
            out.add(new RankedReceiver(
                    e.getKey(),
                    UnicodeEscapes.decode(d.displayReceiverName()),
                    SignalLevels.orFloor(d.getRssi()),
                    d.reportedOnline(),
                    ts.getAsLong(),
                    staleness.formatTime(ts.getAsLong())));
        }
        out.sort(STRONGEST_FIRST);
        return out;
    }
}
