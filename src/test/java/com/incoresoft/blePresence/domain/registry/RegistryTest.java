package com.incoresoft.blePresence.domain.registry;

import com.incoresoft.blePresence.domain.registry.dto.BeaconDto;
import com.incoresoft.blePresence.domain.registry.dto.DetectionDto;
import com.incoresoft.blePresence.domain.registry.dto.ReceiverAttributes;
import com.incoresoft.blePresence.domain.registry.dto.RegistryDocument;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RegistryTest {

    private static DetectionDto detection(int rssi) {
        return DetectionDto.builder().receiverName("Hall").rssi(rssi).online(true).build();
    }

    @Test
    void upsertObjectSetsFirstSeenOnceAndOverwritesName() {
        Registry registry = new Registry();

        assertThat(registry.upsertObject("AA:01", "ESP-C3-1", 1_000L)).isTrue();
        assertThat(registry.upsertObject("AA:01", "ESP-C3-1b", 5_000L)).isFalse();
        assertThat(registry.upsertObject("AA:01", null, 6_000L)).isFalse();

        BeaconDto beacon = registry.getObject("AA:01").orElseThrow();
        assertThat(beacon.getFirstSeen()).isEqualTo(1_000L);
        assertThat(beacon.getName()).isEqualTo("ESP-C3-1b");
    }

    @Test
    void upsertDetectionKeepsOneDetectionPerReceiver() {
        Registry registry = new Registry();
        registry.upsertObject("AA:01", "b", 0L);

        registry.upsertDetection("AA:01", "R1", detection(-70), 1_000L);
        registry.upsertDetection("AA:01", "R1", detection(-50), 2_000L);

        Map<String, DetectionDto> detections = registry.getObject("AA:01").orElseThrow().getDetections();
        assertThat(detections).hasSize(1);
        assertThat(detections.get("R1").getRssi()).isEqualTo(-50);
        assertThat(detections.get("R1").getUpdateTime()).isEqualTo(2_000L);
    }

    @Test
    void readsReturnCopies() {
        Registry registry = new Registry();
        registry.upsertObject("AA:01", "b", 0L);
        registry.upsertDetection("AA:01", "R1", detection(-70), 1_000L);

        BeaconDto view = registry.getObject("AA:01").orElseThrow();
        view.setName("changed");
        view.getDetections().clear();
        registry.allObjects().clear();

        BeaconDto stored = registry.getObject("AA:01").orElseThrow();
        assertThat(stored.getName()).isEqualTo("b");
        assertThat(stored.getDetections()).containsKey("R1");
    }

    @Test
    void iterationFollowsInsertionOrder() {
        Registry registry = new Registry();
        registry.upsertReceiver("R2", new ReceiverAttributes("Two", "ESP32", 1, 1), 1L);
        registry.upsertReceiver("R1", new ReceiverAttributes("One", "ESP32", 1, 1), 2L);
        registry.upsertReceiver("R2", new ReceiverAttributes("Two", "ESP32", 1, 1), 3L);

        assertThat(registry.allReceivers().keySet()).containsExactly("R2", "R1");
        assertThat(registry.allReceivers().get("R2").getUpdate()).isEqualTo(3L);
    }

    @Test
    void removeObjectIfEmptyOnlyRemovesBeaconsWithoutDetections() {
        Registry registry = new Registry();
        registry.upsertObject("AA:01", "b", 0L);
        registry.upsertDetection("AA:01", "R1", detection(-70), 1_000L);

        assertThat(registry.removeObjectIfEmpty("AA:01")).isFalse();
        assertThat(registry.removeDetection("AA:01", "R1")).isTrue();
        assertThat(registry.removeObjectIfEmpty("AA:01")).isTrue();
        assertThat(registry.getObject("AA:01")).isEmpty();
        assertThat(registry.removeDetection("AA:01", "R1")).isFalse();
    }

    @Test
    void replaceWithTakesOverDocumentAndTreatsMissingMapsAsEmpty() {
        Registry registry = new Registry();
        registry.upsertObject("AA:01", "b", 0L);

        registry.replaceWith(new RegistryDocument(null, null));

        assertThat(registry.snapshot().isEmpty()).isTrue();
    }
}
