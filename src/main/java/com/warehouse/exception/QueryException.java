package com.warehouse.exception;

/**
 * A read statement failed or a transaction could not be started.
 */
public class QueryException extends InventoryException {

    public QueryException(String message, Throwable cause) {
        super(ErrorCode.QUERY_FAILED, message, cause);
    }
}
