package com.warehouse.exception;

import lombok.Getter;

/**
 * Base type of every failure the inventory engine reports to its callers.
 * The transaction the failure occurred in has always been rolled back by the
 * time one of these reaches the caller.
 */
@Getter
public abstract class InventoryException extends RuntimeException {

    private final ErrorCode errorCode;

    protected InventoryException(ErrorCode errorCode, String message, Throwable cause) {
        super(message != null ? message : errorCode.getMessage(), cause);
        this.errorCode = errorCode;
    }
}
