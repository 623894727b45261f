package com.eventsourcing.examples.shoppingcart;

import com.eventsourcing.core.exception.BusinessRuleException;

import java.util.UUID;

/**
 * Thrown when a shopping cart command violates a business rule.
 */
public class ShoppingCartException extends BusinessRuleException {

    private final ShoppingCartError error;
    private final UUID shoppingCartId;

    public ShoppingCartException(ShoppingCartError error, UUID shoppingCartId) {
        super(error.name(), String.format("%s: %s", error.description(), shoppingCartId));
        this.error = error;
        this.shoppingCartId = shoppingCartId;
    }

    public ShoppingCartError getError() {
        return error;
    }

    public UUID getShoppingCartId() {
        return shoppingCartId;
    }
}
