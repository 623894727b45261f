package com.eventsourcing.examples.shoppingcart;

/**
 * Lifecycle states for a shopping cart.
 */
public enum ShoppingCartStatus {
    /**
     * Open for changes.
     * Transitions: -> CONFIRMED, CANCELED
     */
    PENDING,

    /**
     * Checked out. Terminal state.
     */
    CONFIRMED,

    /**
     * Abandoned. Terminal state.
     */
    CANCELED;

    public boolean isClosed() {
        return this != PENDING;
    }
}
