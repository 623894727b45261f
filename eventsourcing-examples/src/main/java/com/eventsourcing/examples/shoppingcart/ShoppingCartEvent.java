package com.eventsourcing.examples.shoppingcart;

import com.eventsourcing.core.model.DomainEvent;

import java.time.Instant;
import java.util.UUID;

/**
 * Everything that can happen to a shopping cart.
 */
public sealed interface ShoppingCartEvent extends DomainEvent {

    UUID shoppingCartId();

    record ShoppingCartOpened(
        UUID shoppingCartId,
        UUID clientId,
        Instant openedAt
    ) implements ShoppingCartEvent {
    }

    record ProductItemAddedToShoppingCart(
        UUID shoppingCartId,
        PricedProductItem productItem
    ) implements ShoppingCartEvent {
    }

    record ProductItemRemovedFromShoppingCart(
        UUID shoppingCartId,
        PricedProductItem productItem
    ) implements ShoppingCartEvent {
    }

    record ShoppingCartConfirmed(
        UUID shoppingCartId,
        Instant confirmedAt
    ) implements ShoppingCartEvent {
    }

    record ShoppingCartCanceled(
        UUID shoppingCartId,
        Instant canceledAt
    ) implements ShoppingCartEvent {
    }
}
