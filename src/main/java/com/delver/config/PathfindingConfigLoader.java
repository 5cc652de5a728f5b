package com.delver.config;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link PathfindingConfig} from JSON.
 *
 * <p>Keys use snake case ({@code tile_size}, {@code max_expansions}, ...). Any key
 * left out keeps its value from {@link PathfindingConfig#DEFAULT}.
 */
@Slf4j
public class PathfindingConfigLoader {

    /**
     * Classpath location of the bundled configuration.
     */
    public static final String DEFAULT_RESOURCE = "/pathfinding.json";

    private static final Gson GSON = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .create();

    private PathfindingConfigLoader() {
    }

    /**
     * Load the bundled configuration, or the defaults if it is missing or unreadable.
     *
     * @return the configuration
     */
    public static PathfindingConfig loadDefault() {
        try {
            return loadFromResource(DEFAULT_RESOURCE);
        } catch (IOException e) {
            log.warn("Pathfinding config {} not loaded, using defaults: {}", DEFAULT_RESOURCE, e.getMessage());
            return PathfindingConfig.DEFAULT;
        }
    }

    /**
     * Load configuration from a classpath resource.
     *
     * @param resourcePath absolute resource path
     * @return the configuration
     * @throws IOException if the resource is missing or not valid JSON
     */
    public static PathfindingConfig loadFromResource(String resourcePath) throws IOException {
        try (InputStream is = PathfindingConfigLoader.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            try (Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
                PathfindingConfig config = parse(reader);
                log.debug("Loaded pathfinding config from resource {}", resourcePath);
                return config;
            }
        }
    }

    /**
     * Load configuration from a file.
     *
     * @param path the file path
     * @return the configuration
     * @throws IOException if the file cannot be read or is not valid JSON
     */
    public static PathfindingConfig loadFromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            PathfindingConfig config = parse(reader);
            log.debug("Loaded pathfinding config from {}", path);
            return config;
        }
    }

    /**
     * Parse configuration JSON.
     *
     * @param reader JSON source
     * @return the configuration
     * @throws IOException if the JSON is malformed
     */
    public static PathfindingConfig parse(Reader reader) throws IOException {
        ConfigData data;
        try {
            data = GSON.fromJson(reader, ConfigData.class);
        } catch (JsonParseException e) {
            throw new IOException("Malformed pathfinding config: " + e.getMessage(), e);
        }
        if (data == null) {
            return PathfindingConfig.DEFAULT;
        }
        return data.applyTo(PathfindingConfig.DEFAULT);
    }

    // ========================================================================
    // JSON Data Class
    // ========================================================================

    private static class ConfigData {
        Integer tileSize;
        Integer maxExpansions;
        Integer maxWaypoints;
        Double wallClearance;
        Double doorwayClearance;
        Integer wallPenaltyRadius;
        Double adjacentWallPenalty;
        Double doorwayWallPenalty;
        Integer stuckThreshold;
        Integer escapeMaxDistance;
        Integer openSpaceNeighbours;
        Double escapeWallWeight;
        Double escapeOpenWeight;
        Double simplifyTolerance;
        Long replanIntervalMillis;
        Double arrivalRadius;

        PathfindingConfig applyTo(PathfindingConfig base) {
            PathfindingConfig.PathfindingConfigBuilder builder = base.toBuilder();
            if (tileSize != null) {
                builder.tileSize(tileSize);
            }
            if (maxExpansions != null) {
                builder.maxExpansions(maxExpansions);
            }
            if (maxWaypoints != null) {
                builder.maxWaypoints(maxWaypoints);
            }
            if (wallClearance != null) {
                builder.wallClearance(wallClearance);
            }
            if (doorwayClearance != null) {
                builder.doorwayClearance(doorwayClearance);
            }
            if (wallPenaltyRadius != null) {
                builder.wallPenaltyRadius(wallPenaltyRadius);
            }
            if (adjacentWallPenalty != null) {
                builder.adjacentWallPenalty(adjacentWallPenalty);
            }
            if (doorwayWallPenalty != null) {
                builder.doorwayWallPenalty(doorwayWallPenalty);
            }
            if (stuckThreshold != null) {
                builder.stuckThreshold(stuckThreshold);
            }
            if (escapeMaxDistance != null) {
                builder.escapeMaxDistance(escapeMaxDistance);
            }
            if (openSpaceNeighbours != null) {
                builder.openSpaceNeighbours(openSpaceNeighbours);
            }
            if (escapeWallWeight != null) {
                builder.escapeWallWeight(escapeWallWeight);
            }
            if (escapeOpenWeight != null) {
                builder.escapeOpenWeight(escapeOpenWeight);
            }
            if (simplifyTolerance != null) {
                builder.simplifyTolerance(simplifyTolerance);
            }
            if (replanIntervalMillis != null) {
                builder.replanIntervalMillis(replanIntervalMillis);
            }
            if (arrivalRadius != null) {
                builder.arrivalRadius(arrivalRadius);
            }
            return builder.build();
        }
    }
}
