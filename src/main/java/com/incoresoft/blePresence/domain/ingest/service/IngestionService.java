package com.incoresoft.blePresence.domain.ingest.service;

import com.incoresoft.blePresence.domain.ingest.dto.BeaconEntryDto;
import com.incoresoft.blePresence.domain.ingest.dto.IngestResult;
import com.incoresoft.blePresence.domain.ingest.dto.ReceiverReportDto;
import com.incoresoft.blePresence.domain.ingest.dto.SignalStrength;
import com.incoresoft.blePresence.domain.registry.RegistryWriter;
import com.incoresoft.blePresence.domain.registry.WriteResult;
import com.incoresoft.blePresence.domain.registry.dto.DetectionDto;
import com.incoresoft.blePresence.domain.registry.dto.ReceiverAttributes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Folds receiver reports into the registry.
 * <p>
 * A report without a receiver id is dropped whole; an entry without a MAC is dropped
 * alone. Replaying a report only refreshes timestamps: detections are keyed by
 * (beacon, receiver) and overwritten in place.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {
    static final String DEFAULT_RECEIVER_TYPE = "ESP32";

    private final RegistryWriter writer;
    private final Clock clock;

    public IngestResult ingest(ReceiverReportDto report) {
        return ingest(report, clock.millis());
    }

    public IngestResult ingest(ReceiverReportDto report, long now) {
        if (report == null || StringUtils.isBlank(report.getDeviceId())) {
            log.warn("[INGEST] Rejected report without receiver id");
            return IngestResult.rejected("missing receiver id");
        }
        String receiverId = report.getDeviceId();
        String receiverName = StringUtils.defaultIfBlank(report.getDeviceName(), receiverId);
        ReceiverReportDto.EventData data = report.getEventData() != null
                ? report.getEventData() : new ReceiverReportDto.EventData();
        int batch = positiveOr(data.getBatch(), 1);
        int totalBatches = positiveOr(data.getTotalBatches(), 1);
        ReceiverAttributes attrs = new ReceiverAttributes(receiverName,
                StringUtils.defaultIfBlank(report.getDeviceType(), DEFAULT_RECEIVER_TYPE), batch, totalBatches);

        // normalize outside the writer lock
        List<NormalizedEntry> entries = new ArrayList<>();
        int skipped = 0;
        for (BeaconEntryDto entry : data.getBeacons() == null ? List.<BeaconEntryDto>of() : data.getBeacons()) {
            if (entry == null || StringUtils.isBlank(entry.getMac())) {
                skipped++;
                continue;
            }
            DetectionDto detection = DetectionDto.builder()
                    .receiverName(receiverName)
                    .rssi(SignalStrength.resolve(entry.getRssi()))
                    .online(Boolean.TRUE.equals(entry.getOnline()))
                    .updateTime(now)
                    .build();
            entries.add(new NormalizedEntry(entry.getMac(), StringUtils.trimToNull(entry.getName()), detection));
        }
        if (skipped > 0) {
            log.warn("[INGEST] {} skipped {} beacon entries without mac", receiverId, skipped);
        }

        WriteResult<Integer> result = writer.mutate("ingest from " + receiverId, registry -> {
            registry.upsertReceiver(receiverId, attrs, now);
            for (NormalizedEntry e : entries) {
                registry.upsertObject(e.mac(), e.name(), now);
                registry.upsertDetection(e.mac(), receiverId, e.detection(), now);
            }
            return entries.size();
        });

        String batchInfo = totalBatches > 1 ? String.format(" (batch %d/%d)", batch, totalBatches) : "";
        log.info("[INGEST] {} reported {} beacons{}", receiverName, entries.size(), batchInfo);
        String message = result.persisted() ? "merged" : "merged, not persisted";
        return new IngestResult(true, receiverId, result.value(), skipped, result.persisted(), message);
    }

    private static int positiveOr(Integer value, int fallback) {
        return value == null || value < 1 ? fallback : value;
    }

    private record NormalizedEntry(String mac, String name, DetectionDto detection) {
    }
}
