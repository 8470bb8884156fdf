package org.iceforge.ocient.connector.web;

import org.iceforge.ocient.connector.model.QueryStatus;
import org.iceforge.ocient.connector.service.DistinctValuesException;
import org.iceforge.ocient.connector.service.QueryValidationException;
import org.iceforge.ocient.connector.service.RemoteQueryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.stream.Collectors;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(QueryValidationException.class)
    public ResponseEntity<ErrorResponse> badRequest(RuntimeException e) {
        return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse("VALIDATION_ERROR", e.getMessage()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> invalidBody(WebExchangeBindException e) {
        String detail = e.getFieldErrors().stream()
                .map(f -> f.getField() + ": " + f.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse("VALIDATION_ERROR", detail));
    }

    @ExceptionHandler(DistinctValuesException.class)
    public ResponseEntity<ErrorResponse> distinctValues(DistinctValuesException e) {
        logger.warn(e.getMessage());
        QueryStatus s = e.getStatus();
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse("DISTINCT_VALUES_ERROR", e.getMessage(), e.getColumn(),
                        s == null ? null : s.sqlState(), s == null ? null : s.vendorCode()));
    }

    @ExceptionHandler(RemoteQueryException.class)
    public ResponseEntity<ErrorResponse> remoteQuery(RemoteQueryException e) {
        logger.warn(e.getMessage());
        QueryStatus s = e.getStatus();
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse(e.getKind().name(), e.getMessage(), null,
                        s == null ? null : s.sqlState(), s == null ? null : s.vendorCode()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> serverError(RuntimeException e) {
        logger.error("Request failed", e);
        return ResponseEntity.internalServerError().contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse("SERVER_ERROR", e.getMessage()));
    }
}
