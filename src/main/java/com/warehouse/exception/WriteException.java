package com.warehouse.exception;

import org.springframework.dao.DataIntegrityViolationException;

/**
 * An insert, update or commit failed. Failures caused by the submitted data
 * (constraint violations, unparseable quantities) are classified as
 * {@link ErrorCode#WRITE_REJECTED}; everything else as {@link ErrorCode#WRITE_FAILED}.
 */
public class WriteException extends InventoryException {

    public WriteException(String message, Throwable cause) {
        super(classify(cause), message, cause);
    }

    public WriteException(ErrorCode errorCode, String message) {
        super(errorCode, message, null);
    }

    private static ErrorCode classify(Throwable cause) {
        if (cause instanceof DataIntegrityViolationException || cause instanceof NumberFormatException) {
            return ErrorCode.WRITE_REJECTED;
        }
        return ErrorCode.WRITE_FAILED;
    }
}
