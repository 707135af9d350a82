package com.excelcli.app.exceptions;

import com.excelcli.app.services.TableService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Catches table exceptions from the controllers or services,
 * returning error JSON with a 4xx code for bad input instead of 500.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // The table text itself is malformed
    @ExceptionHandler({LexException.class, ParseException.class, InvalidCloneDirectionException.class})
    public ResponseEntity<ErrorResponse> handleMalformedTable(TableException ex) {
        return respond(ex, HttpStatus.BAD_REQUEST);
    }

    // The table parses but cannot be evaluated
    @ExceptionHandler({CircularReferenceException.class, CloneOutOfBoundsException.class,
            TextInArithmeticException.class, ReferenceOutOfBoundsException.class,
            RecursionLimitExceededException.class})
    public ResponseEntity<ErrorResponse> handleUnevaluableTable(TableException ex) {
        return respond(ex, HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<ErrorResponse> handleInvariantViolation(InvariantViolationException ex) {
        log.error("Internal invariant violated", ex);
        return new ResponseEntity<>(ErrorResponse.of(ex), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        // Catch-all for other runtime exceptions we haven't explicitly handled
        log.error("Unhandled error", ex);
        ErrorResponse error = new ErrorResponse("SERVER_ERROR", ex.getMessage(), null, null);
        return new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> respond(TableException ex, HttpStatus status) {
        log.warn("Rejected table: {}", ex.toDiagnostic(TableService.REQUEST_LABEL));
        return new ResponseEntity<>(ErrorResponse.of(ex), status);
    }
}
