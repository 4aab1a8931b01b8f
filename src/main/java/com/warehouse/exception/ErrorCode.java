package com.warehouse.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Failure kinds raised by the inventory engine, with the HTTP status the
 * web layer renders them as.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "INVENTORY_1503", "store is not reachable"),
    QUERY_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "INVENTORY_1500", "inventory query failed"),
    WRITE_REJECTED(HttpStatus.BAD_REQUEST, "INVENTORY_1400", "inventory write rejected"),
    WRITE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "INVENTORY_1501", "inventory write failed"),
    PRODUCT_NOT_FOUND(HttpStatus.NOT_FOUND, "PRODUCT_2404", "this product is not in system, cannot be sold"),
    OUT_OF_STOCK(HttpStatus.CONFLICT, "PRODUCT_2409", "this product is not in stock, cannot be sold");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;
}
