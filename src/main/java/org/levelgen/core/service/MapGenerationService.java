package org.levelgen.core.service;

import org.levelgen.core.generation.MapGenerator;
import org.levelgen.core.io.MapModelSerializer;
import org.levelgen.core.model.MapModel;
import org.levelgen.core.model.MapType;
import org.levelgen.core.model.config.MapOptions;

public class MapGenerationService {

    private final MapGenerator generator;

    public MapGenerationService(MapGenerator generator) {
        this.generator = generator;
    }

    public MapGenerationService() {
        this(new MapGenerator());
    }

    // options are copied by the generator, callers may keep mutating theirs
    public MapModel generate(MapType type, MapOptions options) {
        return generator.generateMap(type, options);
    }

    public MapNavigator navigatorFor(MapModel model) {
        return new MapNavigator(model);
    }

    public String encodeJson(MapModel model) {
        return MapModelSerializer.toJson(model);
    }
}
