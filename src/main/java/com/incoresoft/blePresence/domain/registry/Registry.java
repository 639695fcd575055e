package com.incoresoft.blePresence.domain.registry;

import com.incoresoft.blePresence.domain.registry.dto.BeaconDto;
import com.incoresoft.blePresence.domain.registry.dto.DetectionDto;
import com.incoresoft.blePresence.domain.registry.dto.ReceiverAttributes;
import com.incoresoft.blePresence.domain.registry.dto.ReceiverDto;
import com.incoresoft.blePresence.domain.registry.dto.RegistryDocument;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * In-memory state of all receivers and beacons. The only owner of these records:
 * every read hands out copies, every change goes through the methods below.
 * Iteration order is insertion order.
 * <p>
 * Callers that need several changes to appear at once (a whole report, a sweep)
 * wrap them in {@link #inWriteLock(Supplier)}; serialization of writers against
 * each other is done by {@link RegistryWriter}.
 */
@Component
public class Registry {
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, ReceiverDto> receivers = new LinkedHashMap<>();
    private final Map<String, BeaconDto> beacons = new LinkedHashMap<>();

    public void upsertReceiver(String id, ReceiverAttributes attrs, long now) {
        inWriteLock(() -> {
            ReceiverDto receiver = receivers.computeIfAbsent(id, k -> new ReceiverDto());
            receiver.setName(attrs.name());
            receiver.setType(attrs.type());
            receiver.setUpdate(now);
            receiver.setBatch(attrs.batch());
            receiver.setTotalBatches(attrs.totalBatches());
            return null;
        });
    }

    /**
     * Creates the beacon with {@code first_seen = now} or, for a known beacon,
     * overwrites its name when one is given.
     *
     * @return true when the beacon was created
     */
    public boolean upsertObject(String address, String name, long now) {
        return inWriteLock(() -> {
            BeaconDto beacon = beacons.get(address);
            if (beacon == null) {
                beacons.put(address, new BeaconDto(name, now));
                return true;
            }
            if (name != null) beacon.setName(name);
            return false;
        });
    }

    /** Stores the detection for (beacon, receiver), replacing any previous one for the pair. */
    public void upsertDetection(String objectId, String receiverId, DetectionDto detection, long now) {
        inWriteLock(() -> {
            BeaconDto beacon = beacons.computeIfAbsent(objectId, k -> new BeaconDto(null, now));
            DetectionDto stored = detection.copy();
            stored.setUpdateTime(now);
            beacon.getDetections().put(receiverId, stored);
            return null;
        });
    }

    public Optional<BeaconDto> getObject(String address) {
        return inReadLock(() -> Optional.ofNullable(beacons.get(address)).map(BeaconDto::copy));
    }

    public Map<String, BeaconDto> allObjects() {
        return inReadLock(() -> {
            Map<String, BeaconDto> out = new LinkedHashMap<>();
            beacons.forEach((mac, b) -> out.put(mac, b.copy()));
            return out;
        });
    }

    public Map<String, ReceiverDto> allReceivers() {
        return inReadLock(() -> {
            Map<String, ReceiverDto> out = new LinkedHashMap<>();
            receivers.forEach((id, r) -> out.put(id, r.copy()));
            return out;
        });
    }

    public boolean removeReceiver(String id) {
        return inWriteLock(() -> receivers.remove(id) != null);
    }

    public boolean removeDetection(String objectId, String receiverId) {
        return inWriteLock(() -> {
            BeaconDto beacon = beacons.get(objectId);
            return beacon != null && beacon.getDetections().remove(receiverId) != null;
        });
    }

    public boolean removeObjectIfEmpty(String objectId) {
        return inWriteLock(() -> {
            BeaconDto beacon = beacons.get(objectId);
            if (beacon == null || !beacon.getDetections().isEmpty()) return false;
            beacons.remove(objectId);
            return true;
        });
    }

    /** Drops the current state and takes over a copy of the given document. */
    public void replaceWith(RegistryDocument document) {
        RegistryDocument source = document.copy().normalized();
        inWriteLock(() -> {
            receivers.clear();
            beacons.clear();
            receivers.putAll(source.getDevices());
            beacons.putAll(source.getBeacons());
            return null;
        });
    }

    public RegistryDocument snapshot() {
        return inReadLock(() -> new RegistryDocument(new LinkedHashMap<>(receivers), new LinkedHashMap<>(beacons)).copy());
    }

    public <T> T inWriteLock(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T inReadLock(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }
}
