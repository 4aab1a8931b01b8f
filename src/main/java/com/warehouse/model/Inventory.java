package com.warehouse.model;

import java.util.List;

/**
 * Inventory upload payload.
 */
public record Inventory(List<Stock> inventory) {
    public Inventory {
        inventory = inventory == null ? List.of() : List.copyOf(inventory);
    }
}
