package com.incoresoft.blePresence.domain.registry;

import com.incoresoft.blePresence.domain.registry.dto.RegistryDocument;
import com.incoresoft.blePresence.repository.RegistryStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Single entry point for changes to the {@link Registry}. Writers (ingestion, reaper,
 * reset) run one at a time, each one merging into memory and then saving the whole
 * document. Readers are only held up by the in-memory part, never by the file write.
 * <p>
 * A failed save is logged and reported in the {@link WriteResult}; the in-memory
 * state keeps the change.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RegistryWriter {
    private final Registry registry;
    private final RegistryStore store;
    private final ReentrantLock writerLock = new ReentrantLock(true);

    /** Loads the stored document into memory at startup. */
    @PostConstruct
    public void init() {
        writerLock.lock();
        try {
            RegistryDocument doc = store.load();
            registry.replaceWith(doc);
            log.info("[REGISTRY] Loaded {} receivers, {} beacons", doc.getDevices().size(), doc.getBeacons().size());
        } finally {
            writerLock.unlock();
        }
    }

    public <T> WriteResult<T> mutate(String reason, Function<Registry, T> change) {
        return mutate(reason, change, value -> true);
    }

    /**
     * Applies {@code change} atomically with respect to readers and saves the document
     * when {@code persistWhen} accepts the produced value.
     */
    public <T> WriteResult<T> mutate(String reason, Function<Registry, T> change, Predicate<? super T> persistWhen) {
        writerLock.lock();
        try {
            T value = registry.inWriteLock(() -> change.apply(registry));
            if (!persistWhen.test(value)) {
                return new WriteResult<>(value, false);
            }
            return new WriteResult<>(value, persist(reason));
        } finally {
            writerLock.unlock();
        }
    }

    /** Replaces everything with an empty document. */
    public boolean reset() {
        WriteResult<Void> result = mutate("reset", r -> {
            r.replaceWith(RegistryDocument.empty());
            return null;
        });
        log.info("[REGISTRY] Reset, persisted={}", result.persisted());
        return result.persisted();
    }

    private boolean persist(String reason) {
        try {
            store.save(registry.snapshot());
            return true;
        } catch (RuntimeException ex) {
            log.error("[REGISTRY] Failed to persist after {}: {}", reason, ex.getMessage(), ex);
            return false;
        }
    }
}
