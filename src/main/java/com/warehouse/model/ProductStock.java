package com.warehouse.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Derived availability of a product: how many units can be built from the
 * articles currently on hand.
 */
public record ProductStock(
    String name,
    @JsonProperty("available_product_no") String availableProductNo
) {}
