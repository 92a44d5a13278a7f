package org.levelgen.core.model;

import java.util.List;
import java.util.Objects;

public final class NpcSpawn {

    public final int x;
    public final int y;
    public final String kind;
    public final boolean isShop;
    /** Shop category, null for non-shop NPCs. */
    public final String shopKind;
    public final List<ShopItem> shopItems;
    public final List<String> dialogueLines;

    public NpcSpawn(int x, int y, String kind, boolean isShop, String shopKind,
                    List<ShopItem> shopItems, List<String> dialogueLines) {
        this.x = x;
        this.y = y;
        this.kind = kind;
        this.isShop = isShop;
        this.shopKind = shopKind;
        this.shopItems = (shopItems == null) ? List.of() : List.copyOf(shopItems);
        this.dialogueLines = (dialogueLines == null) ? List.of() : List.copyOf(dialogueLines);
    }

    public static NpcSpawn regular(int x, int y, String kind, List<String> dialogueLines) {
        return new NpcSpawn(x, y, kind, false, null, List.of(), dialogueLines);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NpcSpawn n)) return false;
        return x == n.x && y == n.y && isShop == n.isShop
                && Objects.equals(kind, n.kind)
                && Objects.equals(shopKind, n.shopKind)
                && shopItems.equals(n.shopItems)
                && dialogueLines.equals(n.dialogueLines);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, kind, isShop, shopKind, shopItems, dialogueLines);
    }
}
