package org.levelgen.core.model;

public record ShopItem(String id, int price) {
}
