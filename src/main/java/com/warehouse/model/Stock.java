package com.warehouse.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Article stock as it travels over the wire: used both for inventory upload
 * entries and for the inventory read projection. Quantity is decimal text.
 */
public record Stock(
    @JsonProperty("art_id") String artId,
    String name,
    String stock
) {}
