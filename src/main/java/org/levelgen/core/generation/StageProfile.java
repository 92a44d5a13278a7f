package org.levelgen.core.generation;

import org.levelgen.core.model.MapType;

import java.util.EnumSet;
import java.util.Set;

public class StageProfile {
    private final Set<StageId> enabled;

    private StageProfile(Set<StageId> enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled(StageId id) {
        return enabled.contains(id);
    }

    public static StageProfile full() {
        return new StageProfile(EnumSet.allOf(StageId.class));
    }

    /** NPCs only live in towns. */
    public static StageProfile forMapType(MapType type) {
        if (type == MapType.TOWN) {
            return full();
        }
        return new StageProfile(EnumSet.of(
                StageId.SHAPE,
                StageId.OBJECTS,
                StageId.ENEMIES
        ));
    }

    public static StageProfile of(StageId first, StageId... rest) {
        return new StageProfile(EnumSet.of(first, rest));
    }

    // terrain only, handy for previews and terrain tests
    public static StageProfile shapeOnly() {
        return new StageProfile(EnumSet.of(StageId.SHAPE));
    }
}
