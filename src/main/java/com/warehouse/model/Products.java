package com.warehouse.model;

import java.util.List;

/**
 * Product upload payload.
 */
public record Products(List<Product> products) {
    public Products {
        products = products == null ? List.of() : List.copyOf(products);
    }
}
