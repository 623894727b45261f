package com.eventsourcing.api.rest;

import com.eventsourcing.core.exception.BusinessRuleException;
import com.eventsourcing.core.exception.EventSerializationException;
import com.eventsourcing.core.exception.StreamNotFoundException;
import com.eventsourcing.core.exception.WrongExpectedRevisionException;
import com.eventsourcing.core.model.ExpectedRevision;
import com.eventsourcing.examples.shoppingcart.ShoppingCartError;
import com.eventsourcing.examples.shoppingcart.ShoppingCartException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ProblemDetail;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link GlobalExceptionHandler}, without a Spring context.
 */
@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("maps a missing cart to 404 and other cart rules to 409")
    void handlesShoppingCartErrors() {
        UUID cartId = UUID.randomUUID();

        ProblemDetail notFound = handler.handleShoppingCart(
            new ShoppingCartException(ShoppingCartError.CART_NOT_FOUND, cartId));
        ProblemDetail closed = handler.handleShoppingCart(
            new ShoppingCartException(ShoppingCartError.CART_IS_ALREADY_CLOSED, cartId));

        assertThat(notFound.getStatus()).isEqualTo(404);
        assertThat(notFound.getProperties()).containsEntry("errorCode", "CART_NOT_FOUND");
        assertThat(closed.getStatus()).isEqualTo(409);
        assertThat(closed.getProperties())
            .containsEntry("errorCode", "CART_IS_ALREADY_CLOSED")
            .containsEntry("shoppingCartId", cartId);
    }

    @Test
    @DisplayName("maps other business rules to 409 with their code")
    void handlesBusinessRule() {
        ProblemDetail result = handler.handleBusinessRule(new BusinessRuleException("LIMIT_REACHED", "Too many"));

        assertThat(result.getStatus()).isEqualTo(409);
        assertThat(result.getDetail()).isEqualTo("Too many");
        assertThat(result.getProperties()).containsEntry("errorCode", "LIMIT_REACHED");
    }

    @Test
    @DisplayName("maps a wrong expected revision to 412 with both revisions")
    void handlesWrongExpectedRevision() {
        ProblemDetail result = handler.handleWrongExpectedRevision(
            new WrongExpectedRevisionException("shopping_cart-1", ExpectedRevision.exactly(3), 5));

        assertThat(result.getStatus()).isEqualTo(412);
        assertThat(result.getTitle()).isEqualTo("Precondition Failed");
        assertThat(result.getProperties())
            .containsEntry("errorCode", WrongExpectedRevisionException.ERROR_CODE)
            .containsEntry("streamId", "shopping_cart-1")
            .containsEntry("expectedRevision", "3")
            .containsEntry("actualRevision", 5L);
    }

    @Test
    @DisplayName("maps a missing stream to 404")
    void handlesStreamNotFound() {
        ProblemDetail result = handler.handleStreamNotFound(new StreamNotFoundException("shopping_cart-1"));

        assertThat(result.getStatus()).isEqualTo(404);
        assertThat(result.getProperties()).containsEntry("errorCode", StreamNotFoundException.ERROR_CODE);
    }

    @Test
    @DisplayName("maps IllegalArgumentException to 400 Bad Request")
    void handlesIllegalArgumentAsBadRequest() {
        ProblemDetail result = handler.handleIllegalArgument(new IllegalArgumentException("quantity must be > 0, got 0"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getDetail()).isEqualTo("quantity must be > 0, got 0");
        assertThat(result.getTitle()).isEqualTo("Bad Request");
    }

    @Test
    @DisplayName("hides store failures behind a 500 that keeps the error code")
    void handlesStoreFailure() {
        ProblemDetail result = handler.handleEventSourcing(
            new EventSerializationException("Could not serialize ShoppingCartOpened", new RuntimeException("boom")));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getDetail()).doesNotContain("boom");
        assertThat(result.getProperties()).containsEntry("errorCode", EventSerializationException.ERROR_CODE);
    }

    @Test
    @DisplayName("maps generic Exception to 500 with a timestamp")
    void handlesGenericExceptionAsInternalError() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("something broke"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getTitle()).isEqualTo("Internal Server Error");
        assertThat(result.getProperties()).containsKey("timestamp");
    }
}
