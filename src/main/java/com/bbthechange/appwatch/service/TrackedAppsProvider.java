package com.bbthechange.appwatch.service;

import com.bbthechange.appwatch.config.MonitorProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves the ordered list of tracked app ids for a cycle.
 *
 * A tracked-apps file of the form {@code {"app_ids": ["544007664", ...]}} takes precedence
 * when it exists; otherwise the ids from {@code monitor.tracked-app-ids} are used.
 * The file is re-read every cycle so edits apply without a restart.
 */
@Component
public class TrackedAppsProvider {

    private static final Logger logger = LoggerFactory.getLogger(TrackedAppsProvider.class);

    private final MonitorProperties properties;
    private final ObjectMapper objectMapper;

    public TrackedAppsProvider(MonitorProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * @return distinct, non-blank app ids in configured order
     */
    public List<String> getTrackedAppIds() {
        List<String> fromFile = readTrackedAppsFile();
        return distinct(fromFile != null ? fromFile : properties.getTrackedAppIds());
    }

    private List<String> readTrackedAppsFile() {
        String location = properties.getTrackedAppsFile();
        if (location == null || location.isBlank()) {
            return null;
        }

        Path path = Paths.get(location);
        if (!Files.exists(path)) {
            return null;
        }

        try {
            JsonNode appIds = objectMapper.readTree(path.toFile()).path("app_ids");
            if (!appIds.isArray()) {
                logger.error("Tracked apps file {} has no app_ids array, using configured ids", path);
                return null;
            }
            List<String> ids = new ArrayList<>();
            appIds.forEach(node -> ids.add(node.asText()));
            return ids;
        } catch (IOException e) {
            logger.error("Error loading tracked apps from {}, using configured ids: {}", path, e.getMessage());
            return null;
        }
    }

    private static List<String> distinct(List<String> ids) {
        if (ids == null) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String id : ids) {
            if (id != null && !id.isBlank()) {
                unique.add(id.trim());
            }
        }
        return List.copyOf(unique);
    }
}
