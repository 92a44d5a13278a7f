package org.levelgen.core.generation;

public enum StageId {
    SHAPE,
    OBJECTS,
    ENEMIES,
    NPCS
}
