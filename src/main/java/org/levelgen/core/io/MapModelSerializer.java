package org.levelgen.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.levelgen.core.model.EnemySpawn;
import org.levelgen.core.model.MapModel;
import org.levelgen.core.model.NpcSpawn;
import org.levelgen.core.model.Room;
import org.levelgen.core.model.ShopItem;

/**
 * Compact map export for renderers and tools.
 * Short-key schema:
 * sv = schemaVersion
 * t  = map type id
 * d  = difficulty id
 * s  = seed
 * w, h, ts = width, height, tile size
 * hm = height rows (y-major, 3 decimals)
 * pg = placement rows as cell kind codes (0 floor, 1 water, 2 chest, 3 obstacle, 4 wall)
 * r  = rooms
 * e  = enemies
 * n  = NPCs
 *
 * r item format: [x, y, width, height, doorX, doorY, shop(0|1)]
 * e item format: [x, y, kind, tier, level, groupId(-1 = none)]
 * n item format: {x, y, k, s, sk?, it?: [[id, price]], dl: [lines]}
 */
public class MapModelSerializer {

    public static final int SCHEMA_VERSION = 1;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static String toJson(MapModel model) {
        try {
            return MAPPER.writeValueAsString(toTree(model));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode map " + model.mapType.id() + " seed=" + model.seed, e);
        }
    }

    public static ObjectNode toTree(MapModel model) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("sv", SCHEMA_VERSION);
        root.put("t", model.mapType.id());
        root.put("d", model.difficulty.id());
        root.put("s", model.seed);
        root.put("w", model.width);
        root.put("h", model.height);
        root.put("ts", model.tileSize);

        ArrayNode heights = root.putArray("hm");
        ArrayNode kinds = root.putArray("pg");
        for (int y = 0; y < model.height; y++) {
            ArrayNode hRow = heights.addArray();
            ArrayNode kRow = kinds.addArray();
            for (int x = 0; x < model.width; x++) {
                hRow.add(round3(model.heightAt(x, y)));
                kRow.add(model.kindAt(x, y).code);
            }
        }

        ArrayNode rooms = root.putArray("r");
        for (Room r : model.rooms) {
            ArrayNode item = rooms.addArray();
            item.add(r.x);
            item.add(r.y);
            item.add(r.width);
            item.add(r.height);
            item.add(r.doorX);
            item.add(r.doorY);
            item.add(r.isShop ? 1 : 0);
        }

        ArrayNode enemies = root.putArray("e");
        for (EnemySpawn e : model.enemySpawns) {
            ArrayNode item = enemies.addArray();
            item.add(e.x);
            item.add(e.y);
            item.add(e.kind);
            item.add(e.tier.id());
            item.add(e.level);
            item.add(e.groupId);
        }

        ArrayNode npcs = root.putArray("n");
        for (NpcSpawn n : model.npcSpawns) {
            ObjectNode item = npcs.addObject();
            item.put("x", n.x);
            item.put("y", n.y);
            item.put("k", n.kind);
            item.put("s", n.isShop);
            if (n.isShop) {
                item.put("sk", n.shopKind);
                ArrayNode items = item.putArray("it");
                for (ShopItem it : n.shopItems) {
                    ArrayNode pair = items.addArray();
                    pair.add(it.id());
                    pair.add(it.price());
                }
            }
            ArrayNode lines = item.putArray("dl");
            for (String line : n.dialogueLines) {
                lines.add(line);
            }
        }
        return root;
    }

    private static double round3(double v) {
        return Math.round(v * 1000.0) / 1000.0;
    }
}
