package com.bbthechange.appwatch.repository.impl;

import com.bbthechange.appwatch.config.MonitorProperties;
import com.bbthechange.appwatch.exception.StoreException;
import com.bbthechange.appwatch.model.VersionSnapshot;
import com.bbthechange.appwatch.repository.VersionStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.TreeMap;

/**
 * Version store backed by a flat JSON object on disk, e.g. {@code {"544007664": "19.10.3"}}.
 *
 * Writes go to a sibling temp file which is then moved over the target, so a reader
 * never observes a partially written mapping.
 */
@Repository
public class JsonFileVersionStore implements VersionStore {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileVersionStore.class);
    private static final TypeReference<Map<String, String>> MAPPING_TYPE = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;

    @Autowired
    public JsonFileVersionStore(MonitorProperties properties, ObjectMapper objectMapper) {
        this(Paths.get(properties.getStateFile()), objectMapper);
    }

    public JsonFileVersionStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    @Override
    public VersionSnapshot load() {
        if (!Files.exists(file)) {
            logger.info("No version state at {}, starting from an empty snapshot", file);
            return VersionSnapshot.empty();
        }

        try {
            Map<String, String> versions = objectMapper.readValue(file.toFile(), MAPPING_TYPE);
            if (versions == null) {
                throw new StoreException("Version state file " + file + " is empty");
            }
            logger.debug("Loaded {} stored versions from {}", versions.size(), file);
            return VersionSnapshot.of(versions);
        } catch (IOException e) {
            throw new StoreException("Failed to read version state from " + file, e);
        }
    }

    @Override
    public void commit(Map<String, String> versions) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            objectMapper.writeValue(tmp.toFile(), new TreeMap<>(versions));

            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.warn("Atomic move not supported for {}, falling back to replace", file);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.debug("Committed {} versions to {}", versions.size(), file);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StoreException("Failed to write version state to " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }

    private void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            logger.warn("Could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }
}
