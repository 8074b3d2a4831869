package com.shardrouter.adapter.in.web;

import com.shardrouter.adapter.in.web.RoutingAdminController.ErrorResponse;
import com.shardrouter.infrastructure.exception.ConfigurationException;
import com.shardrouter.infrastructure.exception.TransactionConnectionMismatchException;
import com.shardrouter.infrastructure.exception.UnknownShardException;
import com.shardrouter.infrastructure.exception.UnresolvedShardException;
import com.shardrouter.infrastructure.filter.RoutingContextFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception handler for routing failures and unexpected errors.
 * Expected input validation errors are handled via Result types in controllers.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("VALIDATION_ERROR", ex.getMessage(), requestId()));
    }

    @ExceptionHandler(UnknownShardException.class)
    public ResponseEntity<ErrorResponse> handleUnknownShard(UnknownShardException ex) {
        log.warn("Unknown shard: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ErrorResponse(ex.getErrorCode(), ex.getMessage(), requestId()));
    }

    @ExceptionHandler(UnresolvedShardException.class)
    public ResponseEntity<ErrorResponse> handleUnresolvedShard(UnresolvedShardException ex) {
        log.warn("Unresolved shard: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(new ErrorResponse(ex.getErrorCode(), ex.getMessage(), requestId()));
    }

    @ExceptionHandler(TransactionConnectionMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTransactionMismatch(TransactionConnectionMismatchException ex) {
        log.warn("Transaction connection mismatch: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new ErrorResponse(ex.getErrorCode(), ex.getMessage(), requestId()));
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(ConfigurationException ex) {
        log.error("Routing configuration error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse(ex.getErrorCode(), ex.getMessage(), requestId()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("INTERNAL_ERROR", "An unexpected error occurred", requestId()));
    }

    private static String requestId() {
        return MDC.get(RoutingContextFilter.REQUEST_ID_MDC_KEY);
    }
}
