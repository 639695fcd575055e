package com.incoresoft.blePresence.domain.query.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.incoresoft.blePresence.config.BleProps;
import com.incoresoft.blePresence.domain.presence.dto.RankedReceiver;
import com.incoresoft.blePresence.domain.presence.service.PresenceResolver;
import com.incoresoft.blePresence.domain.presence.service.StalenessEvaluator;
import com.incoresoft.blePresence.domain.query.BeaconNotFoundException;
import com.incoresoft.blePresence.domain.query.dto.ActiveBeacon;
import com.incoresoft.blePresence.domain.query.dto.BeaconDetail;
import com.incoresoft.blePresence.domain.query.dto.BeaconReceivers;
import com.incoresoft.blePresence.domain.query.dto.BeaconSummary;
import com.incoresoft.blePresence.domain.query.dto.LocatedBeacon;
import com.incoresoft.blePresence.domain.query.dto.RegistryStatistics;
import com.incoresoft.blePresence.domain.query.dto.RssiStats;
import com.incoresoft.blePresence.domain.query.dto.StatusSummary;
import com.incoresoft.blePresence.domain.query.dto.TaggedBeacon;
import com.incoresoft.blePresence.domain.registry.Registry;
import com.incoresoft.blePresence.domain.registry.dto.BeaconDto;
import com.incoresoft.blePresence.domain.registry.dto.DetectionDto;
import com.incoresoft.blePresence.domain.registry.dto.ReceiverDto;
import com.incoresoft.blePresence.domain.registry.dto.RegistryDocument;
import com.incoresoft.blePresence.domain.shared.BeaconDisplayNames;
import com.incoresoft.blePresence.domain.shared.SignalLevels;
import com.incoresoft.blePresence.domain.shared.UnicodeEscapes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Read-only views over the registry. Nothing here changes state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PresenceQueryService {
    private final Registry registry;
    private final StalenessEvaluator staleness;
    private final PresenceResolver resolver;
    private final BleProps props;
    private final ObjectMapper objectMapper;

    /**
     * MAC match first, then name match. Names are not unique: the first beacon in
     * registry order with that name wins.
     */
    public Optional<LocatedBeacon> findObject(String identityOrAddress) {
        if (identityOrAddress == null) return Optional.empty();
        Optional<BeaconDto> byMac = registry.getObject(identityOrAddress);
        if (byMac.isPresent()) {
            return Optional.of(new LocatedBeacon(identityOrAddress, byMac.get()));
        }
        for (Map.Entry<String, BeaconDto> e : registry.allObjects().entrySet()) {
            if (identityOrAddress.equals(e.getValue().getName())) {
                return Optional.of(new LocatedBeacon(e.getKey(), e.getValue()));
            }
        }
        return Optional.empty();
    }

    public StatusSummary statusSummary(long now) {
        Map<String, ReceiverDto> receivers = registry.allReceivers();
        int receiverActive = (int) receivers.values().stream()
                .filter(r -> staleness.isReceiverActive(r, now))
                .count();
        Map<String, BeaconDto> beacons = registry.allObjects();
        int beaconActive = (int) beacons.values().stream()
                .filter(b -> b.getDetections().values().stream().anyMatch(d -> staleness.isActive(d, now)))
                .count();
        return new StatusSummary(
                new StatusSummary.Counts(receivers.size(), receiverActive),
                new StatusSummary.Counts(beacons.size(), beaconActive),
                staleness.activeWindowMillis(),
                now);
    }

    /** Whole registry with escaped text decoded, for export and debugging. */
    public RegistryDocument snapshot() {
        RegistryDocument raw = registry.snapshot();
        try {
            return objectMapper.treeToValue(UnicodeEscapes.decodeTree(objectMapper.valueToTree(raw)),
                    RegistryDocument.class).normalized();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Snapshot decode failed, returning raw copy: {}", e.getMessage());
            return raw;
        }
    }

    /** Fresh receivers of a beacon given by MAC or name. */
    public BeaconReceivers receiversFor(String identity, long now) {
        LocatedBeacon found = findObject(identity).orElseThrow(() -> new BeaconNotFoundException(identity));
        List<RankedReceiver> receivers = resolver.rankedReceivers(found.beacon(), now);
        return new BeaconReceivers(found.beacon().getName(), found.mac(),
                BeaconDisplayNames.displayName(found.beacon().getName(), props.getTaggedPrefix()),
                receivers, now);
    }

    /** Beacons named with the tagged prefix that have a fresh receiver, strongest first. */
    public List<TaggedBeacon> taggedBeacons(long now) {
        String prefix = props.getTaggedPrefix();
        List<TaggedBeacon> out = new ArrayList<>();
        for (Map.Entry<String, BeaconDto> e : registry.allObjects().entrySet()) {
            BeaconDto b = e.getValue();
            if (b.getName() == null || prefix == null || !b.getName().startsWith(prefix)) continue;
            if (b.getDetections().isEmpty()) continue;
            List<RankedReceiver> receivers = resolver.rankedReceivers(b, now);
            if (receivers.isEmpty()) continue;
            out.add(new TaggedBeacon(e.getKey(), b.getName(),
                    BeaconDisplayNames.displayName(b.getName(), prefix), receivers, b.getFirstSeen()));
        }
        out.sort(Comparator.comparingInt(TaggedBeacon::strongestRssi).reversed());
        return out;
    }

    /** Beacons with at least one active receiver, strongest first. */
    public List<ActiveBeacon> activeBeacons(long now) {
        List<ActiveBeacon> out = new ArrayList<>();
        registry.allObjects().forEach((mac, b) -> {
            List<RankedReceiver> receivers = resolver.activeReceivers(b, now);
            if (!receivers.isEmpty()) out.add(new ActiveBeacon(mac, b.getName(), receivers));
        });
        out.sort(Comparator.comparingInt(ActiveBeacon::strongestRssi).reversed());
        return out;
    }

    /** Every beacon, active ones first, then by strongest active signal. */
    public List<BeaconSummary> beaconList(long now) {
        List<BeaconSummary> out = new ArrayList<>();
        registry.allObjects().forEach((mac, b) -> {
            int active = 0;
            int strongest = SignalLevels.FLOOR;
            long newest = 0L;
            for (DetectionDto d : b.getDetections().values()) {
                if (staleness.isActive(d, now)) {
                    active++;
                    strongest = Math.max(strongest, SignalLevels.orFloor(d.getRssi()));
                }
                OptionalLong ts = staleness.resolveTimestamp(d);
                if (ts.isPresent() && ts.getAsLong() > newest) newest = ts.getAsLong();
            }
            out.add(new BeaconSummary(mac, b.getName(), active, strongest, newest, active > 0));
        });
        out.sort(Comparator.comparing(BeaconSummary::active).reversed()
                .thenComparing(Comparator.comparingInt(BeaconSummary::strongestRssi).reversed()));
        return out;
    }

    /**
     * First beacon whose name contains {@code nameFragment}. Recent detections
     * (active window) come first by signal, the rest by newest time.
     */
    public Optional<BeaconDetail> beaconDetail(String nameFragment, long now) {
        if (nameFragment == null || nameFragment.isBlank()) return Optional.empty();
        for (Map.Entry<String, BeaconDto> e : registry.allObjects().entrySet()) {
            BeaconDto b = e.getValue();
            if (b.getName() == null || !b.getName().contains(nameFragment)) continue;

            List<BeaconDetail.Line> lines = new ArrayList<>();
            b.getDetections().forEach((receiverId, d) -> {
                long seen = staleness.resolveTimestamp(d).orElse(0L);
                boolean recent = seen > 0 && staleness.isWithin(seen, now, staleness.activeWindowMillis());
                lines.add(new BeaconDetail.Line(receiverId, UnicodeEscapes.decode(d.displayReceiverName()),
                        SignalLevels.orFloor(d.getRssi()), d.reportedOnline(), seen, now - seen, recent));
            });
            lines.sort(Comparator.comparing(BeaconDetail.Line::recent).reversed()
                    .thenComparing((x, y) -> x.recent()
                            ? Integer.compare(y.rssi(), x.rssi())
                            : Long.compare(y.lastSeen(), x.lastSeen())));
            RssiStats stats = RssiStats.of(lines.stream()
                    .filter(BeaconDetail.Line::recent)
                    .map(BeaconDetail.Line::rssi)
                    .toList());
            return Optional.of(new BeaconDetail(e.getKey(), b.getName(), b.getFirstSeen(), lines, stats));
        }
        return Optional.empty();
    }

    public RegistryStatistics statistics(long now) {
        StatusSummary status = statusSummary(now);
        int multi = 0;
        int single = 0;
        List<Integer> samples = new ArrayList<>();
        for (BeaconDto b : registry.allObjects().values()) {
            List<Integer> active = b.getDetections().values().stream()
                    .filter(d -> staleness.isActive(d, now))
                    .map(d -> SignalLevels.orFloor(d.getRssi()))
                    .toList();
            if (active.size() > 1) multi++;
            else if (active.size() == 1) single++;
            samples.addAll(active);
        }
        return new RegistryStatistics(status, multi, single, RssiStats.of(samples));
    }
}
