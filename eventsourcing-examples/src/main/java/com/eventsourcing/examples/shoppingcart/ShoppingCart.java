package com.eventsourcing.examples.shoppingcart;

import com.eventsourcing.examples.shoppingcart.ShoppingCartEvent.ProductItemAddedToShoppingCart;
import com.eventsourcing.examples.shoppingcart.ShoppingCartEvent.ProductItemRemovedFromShoppingCart;
import com.eventsourcing.examples.shoppingcart.ShoppingCartEvent.ShoppingCartCanceled;
import com.eventsourcing.examples.shoppingcart.ShoppingCartEvent.ShoppingCartConfirmed;
import com.eventsourcing.examples.shoppingcart.ShoppingCartEvent.ShoppingCartOpened;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Current state of a shopping cart, rebuilt by folding its events from {@link #initial()}.
 *
 * Invariants:
 * - confirmedAt is set only when status is CONFIRMED
 * - canceledAt is set only when status is CANCELED
 */
public record ShoppingCart(
    UUID id,
    UUID clientId,
    ShoppingCartStatus status,
    ProductItems productItems,
    Instant openedAt,
    Instant confirmedAt,
    Instant canceledAt
) {
    private static final ShoppingCart INITIAL = new ShoppingCart(
        null, null, ShoppingCartStatus.PENDING, ProductItems.empty(), null, null, null);

    /**
     * State before the first event of a stream.
     */
    public static ShoppingCart initial() {
        return INITIAL;
    }

    /**
     * Apply one event. Total over {@link ShoppingCartEvent}; never mutates {@code state}.
     */
    public static ShoppingCart evolve(ShoppingCart state, ShoppingCartEvent event) {
        if (event instanceof ShoppingCartOpened opened) {
            return new ShoppingCart(
                opened.shoppingCartId(),
                opened.clientId(),
                ShoppingCartStatus.PENDING,
                ProductItems.empty(),
                opened.openedAt(),
                null,
                null
            );
        }
        if (event instanceof ProductItemAddedToShoppingCart added) {
            return state.withProductItems(state.productItems().add(added.productItem()));
        }
        if (event instanceof ProductItemRemovedFromShoppingCart removed) {
            return state.withProductItems(state.productItems().remove(removed.productItem()));
        }
        if (event instanceof ShoppingCartConfirmed confirmed) {
            return new ShoppingCart(state.id(), state.clientId(), ShoppingCartStatus.CONFIRMED,
                state.productItems(), state.openedAt(), confirmed.confirmedAt(), null);
        }
        if (event instanceof ShoppingCartCanceled canceled) {
            return new ShoppingCart(state.id(), state.clientId(), ShoppingCartStatus.CANCELED,
                state.productItems(), state.openedAt(), null, canceled.canceledAt());
        }
        throw new IllegalArgumentException("Unknown shopping cart event: " + event);
    }

    public boolean isClosed() {
        return status.isClosed();
    }

    public BigDecimal totalAmount() {
        return productItems.totalAmount();
    }

    private ShoppingCart withProductItems(ProductItems items) {
        return new ShoppingCart(id, clientId, status, items, openedAt, confirmedAt, canceledAt);
    }
}
