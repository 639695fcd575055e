package com.incoresoft.blePresence.domain.registry.service;

import com.incoresoft.blePresence.config.BleProps;
import com.incoresoft.blePresence.domain.presence.service.StalenessEvaluator;
import com.incoresoft.blePresence.domain.registry.Registry;
import com.incoresoft.blePresence.domain.registry.RegistryWriter;
import com.incoresoft.blePresence.domain.registry.WriteResult;
import com.incoresoft.blePresence.domain.registry.dto.BeaconDto;
import com.incoresoft.blePresence.domain.registry.dto.DetectionDto;
import com.incoresoft.blePresence.domain.registry.dto.ReapResult;
import com.incoresoft.blePresence.domain.registry.dto.ReceiverDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.FixedRateTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Drops receivers, detections and beacons older than {@code ble.retentionMinutes}.
 * Retention only bounds storage; it has nothing to do with the freshness and
 * active thresholds used for display.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegistryReaper implements SchedulingConfigurer {
    private final RegistryWriter writer;
    private final StalenessEvaluator staleness;
    private final BleProps props;
    private final Clock clock;

    /** Sweeps every {@code ble.reaper.intervalMinutes}, first run one interval after startup. */
    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        Duration interval = Duration.ofMinutes(props.getReaper().getIntervalMinutes());
        registrar.addFixedRateTask(new FixedRateTask(this::scheduledSweep, interval, interval));
        log.info("[REAP] Scheduled every {} min, retention {} min",
                interval.toMinutes(), props.getRetentionMinutes());
    }

    public void scheduledSweep() {
        if (!props.getReaper().isEnabled()) return;
        sweep(clock.millis());
    }

    public ReapResult sweep(long now) {
        long retention = props.retentionMillis();
        WriteResult<ReapResult> result = writer.mutate("reaper sweep",
                registry -> prune(registry, now, retention),
                r -> r.total() > 0);
        ReapResult reaped = result.value();
        if (reaped.total() > 0) {
            log.info("[REAP] Removed {} receivers, {} detections, {} beacons (persisted={})",
                    reaped.receiversRemoved(), reaped.detectionsRemoved(), reaped.beaconsRemoved(), result.persisted());
        } else {
            log.debug("[REAP] Nothing to remove");
        }
        return reaped;
    }

    private ReapResult prune(Registry registry, long now, long retention) {
        int receivers = 0;
        int detections = 0;
        int beacons = 0;
        for (Map.Entry<String, ReceiverDto> e : registry.allReceivers().entrySet()) {
            Long update = e.getValue().getUpdate();
            if ((update == null || !staleness.isWithin(update, now, retention)) && registry.removeReceiver(e.getKey())) {
                receivers++;
            }
        }
        for (Map.Entry<String, BeaconDto> e : registry.allObjects().entrySet()) {
            String mac = e.getKey();
            for (Map.Entry<String, DetectionDto> d : e.getValue().getDetections().entrySet()) {
                if (!staleness.isFresh(d.getValue(), now, retention) && registry.removeDetection(mac, d.getKey())) {
                    detections++;
                }
            }
            if (registry.removeObjectIfEmpty(mac)) beacons++;
        }
        return new ReapResult(receivers, detections, beacons);
    }
}
