package com.incoresoft.blePresence.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.incoresoft.blePresence.config.BleProps;
import com.incoresoft.blePresence.domain.registry.dto.RegistryDocument;
import com.incoresoft.blePresence.domain.shared.UnicodeEscapes;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Keeps the registry in a single pretty-printed JSON file ({@code ble.dataFile}).
 * Writes go to a temp file next to the target and are moved over it, so a reader
 * never sees a half-written document.
 */
@Slf4j
@Repository
public class JsonFileRegistryStore implements RegistryStore {
    private final ObjectMapper mapper;
    private final Path dataFile;

    @Autowired
    public JsonFileRegistryStore(ObjectMapper mapper, BleProps props) {
        this(mapper, Paths.get(props.getDataFile()));
    }

    public JsonFileRegistryStore(ObjectMapper mapper, Path dataFile) {
        this.mapper = mapper;
        this.dataFile = dataFile;
    }

    /** Creates the data folder and rewrites a missing or broken file as an empty document. */
    @PostConstruct
    public void checkAndRepair() {
        try {
            Path parent = dataFile.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            if (readTree() == null) {
                write(RegistryDocument.empty());
                log.info("[STORE] Initialized data file {}", dataFile.toAbsolutePath());
            }
        } catch (Exception e) {
            log.warn("[STORE] Data file check failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public RegistryDocument load() {
        try {
            JsonNode tree = readTree();
            if (tree == null || !tree.isObject()) {
                return RegistryDocument.empty();
            }
            RegistryDocument doc = mapper.treeToValue(UnicodeEscapes.decodeTree(tree), RegistryDocument.class);
            return doc == null ? RegistryDocument.empty() : doc.normalized();
        } catch (IOException | IllegalArgumentException e) {
            log.warn("[STORE] Unreadable data file {}, starting empty: {}", dataFile, e.getMessage());
            return RegistryDocument.empty();
        }
    }

    @Override
    @Retryable(retryFor = RegistryPersistenceException.class, maxAttempts = 3, backoff = @Backoff(delay = 200))
    public void save(RegistryDocument document) {
        try {
            write(document);
        } catch (IOException e) {
            throw new RegistryPersistenceException("Failed to write " + dataFile, e);
        }
    }

    /** Returns null when the file is missing or is not valid JSON. */
    private JsonNode readTree() throws IOException {
        String content;
        try {
            content = Files.readString(dataFile, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return null;
        }
        if (content.isBlank()) return null;
        try {
            return mapper.readTree(content);
        } catch (JsonProcessingException e) {
            log.warn("[STORE] Invalid JSON in {}: {}", dataFile, e.getOriginalMessage());
            return null;
        }
    }

    private void write(RegistryDocument document) throws IOException {
        Path parent = dataFile.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = Files.createTempFile(parent, dataFile.getFileName().toString(), ".tmp");
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), document);
            try {
                Files.move(tmp, dataFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, dataFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
