package org.levelgen.core.generation;

import org.levelgen.core.model.MapType;

/**
 * Shapes the terrain of one map type: fills both grids and, where the type has them, the rooms.
 * Runs first; object and entity placement only ever work on top of its result.
 */
public interface TerrainStrategy {
    MapType mapType();
    String name();
    void shape(GenerationContext ctx);
}
