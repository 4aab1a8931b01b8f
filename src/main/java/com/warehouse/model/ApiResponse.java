package com.warehouse.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body returned by every warehouse endpoint. Only the populated field is
 * serialized.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse(
    String message,
    List<Stock> inventory,
    @JsonProperty("product_stocks") List<ProductStock> productStocks
) {

    public static ApiResponse message(String message) {
        return new ApiResponse(message, null, null);
    }

    public static ApiResponse inventory(List<Stock> inventory) {
        return new ApiResponse(null, inventory, null);
    }

    public static ApiResponse productStocks(List<ProductStock> productStocks) {
        return new ApiResponse(null, null, productStocks);
    }
}
