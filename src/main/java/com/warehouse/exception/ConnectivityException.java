package com.warehouse.exception;

/**
 * The backing store could not be reached.
 */
public class ConnectivityException extends InventoryException {

    public ConnectivityException(String message, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, message, cause);
    }
}
