package com.delver.navigation;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads a {@link GridTileMap} from JSON.
 *
 * <p>Format:
 * <pre>
 * {
 *   "name": "crypt",
 *   "rows": ["#####", "#...#", "#####"]
 * }
 * </pre>
 * Rows use the {@link GridTileMap#fromRows(String...)} notation.
 */
@Slf4j
public class TileMapLoader {

    private static final Gson GSON = new Gson();

    private TileMapLoader() {
    }

    /**
     * Load a map from a classpath resource.
     *
     * @param resourcePath absolute resource path, e.g. {@code /maps/crypt.json}
     * @return the map
     * @throws IOException if the resource is missing or malformed
     */
    public static GridTileMap loadFromResource(String resourcePath) throws IOException {
        try (InputStream is = TileMapLoader.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            try (Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
                return parse(reader, resourcePath);
            }
        }
    }

    /**
     * Load a map from a file.
     *
     * @param path the file path
     * @return the map
     * @throws IOException if the file cannot be read or is malformed
     */
    public static GridTileMap loadFromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader, path.toString());
        }
    }

    private static GridTileMap parse(Reader reader, String source) throws IOException {
        MapData data;
        try {
            data = GSON.fromJson(reader, MapData.class);
        } catch (JsonParseException e) {
            throw new IOException("Malformed map " + source + ": " + e.getMessage(), e);
        }
        if (data == null || data.rows == null || data.rows.isEmpty()) {
            throw new IOException("Map " + source + " has no rows");
        }

        GridTileMap map;
        try {
            map = GridTileMap.fromRows(data.rows.toArray(new String[0]));
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid map " + source + ": " + e.getMessage(), e);
        }
        log.debug("Loaded map {} ({}x{}) from {}", data.name, map.getWidth(), map.getHeight(), source);
        return map;
    }

    private static class MapData {
        String name;
        List<String> rows;
    }
}
