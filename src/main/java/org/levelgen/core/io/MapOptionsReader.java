package org.levelgen.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.levelgen.core.model.MapType;
import org.levelgen.core.model.config.MapOptions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads generation options from JSON, e.g.
 * {"mapType": "arena", "width": 60, "height": 60, "difficultyLevel": "hell"}.
 * Unknown keys are ignored, missing keys keep their defaults.
 */
public class MapOptionsReader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final class MapRequest {
        public final MapType mapType;
        public final MapOptions options;

        public MapRequest(MapType mapType, MapOptions options) {
            this.mapType = mapType;
            this.options = options;
        }
    }

    public static MapRequest read(Path file) {
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read options file: " + file.toAbsolutePath(), e);
        }
        return parse(json);
    }

    public static MapRequest parse(String json) {
        try {
            JsonNode root = MAPPER.readTree(json);
            if (root == null || !root.isObject()) {
                throw new IllegalStateException("Options must be a JSON object");
            }
            MapType type = MapType.fromId(root.path("mapType").asText(null));
            MapOptions options = MAPPER.treeToValue(root, MapOptions.class);
            return new MapRequest(type, options);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Invalid options JSON: " + e.getOriginalMessage(), e);
        }
    }
}
