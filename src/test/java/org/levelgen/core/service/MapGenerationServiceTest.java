package org.levelgen.core.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.levelgen.core.generation.MapGenerator;
import org.levelgen.core.model.MapModel;
import org.levelgen.core.model.MapType;
import org.levelgen.core.model.config.MapOptions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class MapGenerationServiceTest {

    @Test
    void generatesNavigatesAndEncodes() throws Exception {
        MapGenerationService service = new MapGenerationService(MapGenerator.quiet());
        MapOptions o = new MapOptions(4);
        o.width = 30;
        o.height = 20;

        MapModel map = service.generate(MapType.FIELD, o);
        MapNavigator navigator = service.navigatorFor(map);
        JsonNode json = new ObjectMapper().readTree(service.encodeJson(map));

        assertSame(map, navigator.model());
        assertEquals(30, json.get("w").asInt());
        assertEquals(20, json.get("pg").size());
        assertEquals("field", json.get("t").asText());
    }
}
