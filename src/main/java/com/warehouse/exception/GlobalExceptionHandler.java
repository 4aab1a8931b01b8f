package com.warehouse.exception;

import com.warehouse.model.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Renders every failure as {@code {"message": ...}} with the status its
 * {@link ErrorCode} carries.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InventoryException.class)
    public ResponseEntity<ApiResponse> handleInventoryException(InventoryException e) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode.getHttpStatus().is5xxServerError()) {
            log.error("InventoryException: code={}, message={}", errorCode.getCode(), e.getMessage(), e);
        } else {
            log.warn("InventoryException: code={}, message={}", errorCode.getCode(), e.getMessage());
        }

        return ResponseEntity
                .status(errorCode.getHttpStatus())
                .body(ApiResponse.message(e.getMessage()));
    }

    /**
     * Request body is not valid JSON or does not fit the payload shape.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.message(e.getMostSpecificCause().getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse> handleException(Exception e) {
        if (e instanceof ErrorResponse errorResponse) {
            // unknown route, wrong method, unsupported media type and the like
            log.warn("Rejected request: {}", e.getMessage());
            return ResponseEntity
                    .status(errorResponse.getStatusCode())
                    .body(ApiResponse.message(errorResponse.getBody().getDetail()));
        }

        log.error("UnexpectedException: ", e);

        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.message("internal server error"));
    }
}
