package com.eventsourcing.examples.shoppingcart;

/**
 * Reasons a shopping cart command is rejected. The enum name is the error code.
 */
public enum ShoppingCartError {
    OPENED_EXISTING_CART("Shopping cart already exists"),
    CART_NOT_FOUND("Shopping cart not found"),
    PRODUCT_ITEM_NOT_FOUND("Product item not found in the shopping cart"),
    PRODUCT_ITEM_QUANTITY_TOO_LARGE("Product item quantity exceeds the maximum a cart line can hold"),
    CART_IS_ALREADY_CLOSED("Shopping cart is already closed");

    private final String description;

    ShoppingCartError(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
