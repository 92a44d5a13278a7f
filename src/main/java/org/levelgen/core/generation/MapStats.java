package org.levelgen.core.generation;

import org.levelgen.core.model.CellKind;
import org.levelgen.core.model.EnemySpawn;
import org.levelgen.core.model.EnemyTier;
import org.levelgen.core.model.MapModel;
import org.levelgen.core.model.NpcSpawn;

import java.util.EnumMap;
import java.util.Map;

public class MapStats {

    public int cellCount;
    public int walkableCount;

    public double heightMin = Double.POSITIVE_INFINITY;
    public double heightMax = Double.NEGATIVE_INFINITY;
    public double heightAvg;

    public final Map<CellKind, Integer> kindCounts = new EnumMap<>(CellKind.class);
    public final Map<EnemyTier, Integer> enemyCounts = new EnumMap<>(EnemyTier.class);

    public int roomCount;
    public int shopCount;
    public int enemyGroups;
    public int npcCount;
    public int shopNpcCount;

    public static MapStats compute(MapModel model) {
        MapStats s = new MapStats();
        s.cellCount = model.width * model.height;

        double sum = 0;
        for (int y = 0; y < model.height; y++) {
            for (int x = 0; x < model.width; x++) {
                CellKind kind = model.kindAt(x, y);
                double h = model.heightAt(x, y);
                s.kindCounts.merge(kind, 1, Integer::sum);
                if (CellKind.isWalkable(kind, h)) s.walkableCount++;

                s.heightMin = Math.min(s.heightMin, h);
                s.heightMax = Math.max(s.heightMax, h);
                sum += h;
            }
        }
        s.heightAvg = (s.cellCount > 0) ? sum / s.cellCount : 0.0;

        s.roomCount = model.rooms.size();
        s.shopCount = (int) model.rooms.stream().filter(r -> r.isShop).count();

        int maxGroup = EnemySpawn.NO_GROUP;
        for (EnemySpawn e : model.enemySpawns) {
            s.enemyCounts.merge(e.tier, 1, Integer::sum);
            maxGroup = Math.max(maxGroup, e.groupId);
        }
        s.enemyGroups = maxGroup + 1;

        s.npcCount = model.npcSpawns.size();
        for (NpcSpawn n : model.npcSpawns) {
            if (n.isShop) s.shopNpcCount++;
        }
        return s;
    }

    public int count(CellKind kind) {
        return kindCounts.getOrDefault(kind, 0);
    }

    public int enemies(EnemyTier tier) {
        return enemyCounts.getOrDefault(tier, 0);
    }
}
