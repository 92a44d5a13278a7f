package org.levelgen.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EnemyTier {
    NORMAL,
    ELITE,
    BOSS;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
