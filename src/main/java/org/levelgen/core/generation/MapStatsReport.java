package org.levelgen.core.generation;

import org.levelgen.core.model.CellKind;
import org.levelgen.core.model.EnemyTier;

public class MapStatsReport {

    public static void print(MapStats s) {
        System.out.println();
        System.out.println("========= MAP STATS =========");
        System.out.println("Cells: " + s.cellCount + " walkable=" + s.walkableCount
                + " (" + fmt(pct(s.walkableCount, s.cellCount)) + "%)");
        System.out.println("Height: min=" + fmt(s.heightMin) + " max=" + fmt(s.heightMax)
                + " avg=" + fmt(s.heightAvg));

        System.out.println();
        System.out.println("Cell kinds:");
        for (CellKind kind : CellKind.values()) {
            int count = s.count(kind);
            if (count <= 0) continue;
            System.out.println("  " + pad(kind) + " : " + count);
        }

        System.out.println();
        System.out.println("Rooms: " + s.roomCount + " (shops=" + s.shopCount + ")");
        System.out.println("Enemies: normal=" + s.enemies(EnemyTier.NORMAL)
                + " elite=" + s.enemies(EnemyTier.ELITE)
                + " boss=" + s.enemies(EnemyTier.BOSS)
                + " groups=" + s.enemyGroups);
        System.out.println("NPCs: " + s.npcCount + " (shopkeepers=" + s.shopNpcCount + ")");
        System.out.println("=============================");
        System.out.println();
    }

    private static double pct(int part, int total) {
        return (total > 0) ? 100.0 * part / total : 0.0;
    }

    private static String fmt(double v) {
        if (Double.isInfinite(v) || Double.isNaN(v)) return "n/a";
        return String.format("%.3f", v);
    }

    private static String pad(CellKind kind) {
        String s = kind.name();
        StringBuilder sb = new StringBuilder(s);
        while (sb.length() < 8) sb.append(' ');
        return sb.toString();
    }
}
