package com.eventsourcing.api.rest;

import com.eventsourcing.core.exception.BusinessRuleException;
import com.eventsourcing.core.exception.EventSourcingException;
import com.eventsourcing.core.exception.StreamNotFoundException;
import com.eventsourcing.core.exception.WrongExpectedRevisionException;
import com.eventsourcing.examples.shoppingcart.ShoppingCartError;
import com.eventsourcing.examples.shoppingcart.ShoppingCartException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestValueException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Maps exceptions to RFC 7807 ProblemDetail responses.
 *
 * Domain failures carry their error code in the {@code errorCode} property so clients can
 * branch on it without parsing the detail text.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String BAD_REQUEST_CODE = "BAD_REQUEST";

    @ExceptionHandler(ShoppingCartException.class)
    public ProblemDetail handleShoppingCart(ShoppingCartException ex) {
        HttpStatus status = ex.getError() == ShoppingCartError.CART_NOT_FOUND
            ? HttpStatus.NOT_FOUND
            : HttpStatus.CONFLICT;
        log.info("Shopping cart command rejected: {}", ex.getMessage());
        ProblemDetail problem = problem(status, ex.getMessage(), ex.getErrorCode());
        problem.setProperty("shoppingCartId", ex.getShoppingCartId());
        return problem;
    }

    @ExceptionHandler(BusinessRuleException.class)
    public ProblemDetail handleBusinessRule(BusinessRuleException ex) {
        log.info("Command rejected: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, ex.getMessage(), ex.getErrorCode());
    }

    @ExceptionHandler(WrongExpectedRevisionException.class)
    public ProblemDetail handleWrongExpectedRevision(WrongExpectedRevisionException ex) {
        log.info("Precondition failed: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.PRECONDITION_FAILED, ex.getMessage(), ex.getErrorCode());
        problem.setProperty("streamId", ex.getStreamId());
        problem.setProperty("expectedRevision", ex.getExpectedRevision().toString());
        problem.setProperty("actualRevision", ex.getActualRevision());
        return problem;
    }

    @ExceptionHandler(StreamNotFoundException.class)
    public ProblemDetail handleStreamNotFound(StreamNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, ex.getMessage(), ex.getErrorCode());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), BAD_REQUEST_CODE);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class,
        MissingRequestValueException.class
    })
    public ProblemDetail handleMalformedRequest(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Malformed request: " + ex.getMessage(), BAD_REQUEST_CODE);
    }

    @ExceptionHandler(EventSourcingException.class)
    public ProblemDetail handleEventSourcing(EventSourcingException ex) {
        log.error("Event store failure [{}]", ex.getErrorCode(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Event store failure", ex.getErrorCode());
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", "INTERNAL_ERROR");
    }

    private static ProblemDetail problem(HttpStatus status, String detail, String errorCode) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(status.getReasonPhrase());
        problem.setProperty("errorCode", errorCode);
        problem.setProperty("timestamp", Instant.now().toString());
        return problem;
    }
}
