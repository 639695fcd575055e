package com.incoresoft.blePresence.repository;

import com.incoresoft.blePresence.domain.registry.dto.RegistryDocument;

/**
 * Durable home of the registry, read and written as one document.
 */
public interface RegistryStore {

    /**
     * Reads the whole document. A missing or unreadable document yields an empty one,
     * never an exception.
     */
    RegistryDocument load();

    /**
     * Overwrites the whole document.
     *
     * @throws RegistryPersistenceException when the document could not be written
     */
    void save(RegistryDocument document);
}
