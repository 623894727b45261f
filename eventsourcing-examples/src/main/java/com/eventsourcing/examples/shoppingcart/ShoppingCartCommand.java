package com.eventsourcing.examples.shoppingcart;

import com.eventsourcing.core.model.DomainCommand;

import java.time.Instant;
import java.util.UUID;

/**
 * Requests to change a shopping cart. The time of the request travels with the
 * command so that deciding stays pure.
 */
public sealed interface ShoppingCartCommand extends DomainCommand {

    UUID shoppingCartId();

    record OpenShoppingCart(
        UUID shoppingCartId,
        UUID clientId,
        Instant now
    ) implements ShoppingCartCommand {
    }

    record AddProductItemToShoppingCart(
        UUID shoppingCartId,
        PricedProductItem productItem
    ) implements ShoppingCartCommand {
    }

    record RemoveProductItemFromShoppingCart(
        UUID shoppingCartId,
        PricedProductItem productItem
    ) implements ShoppingCartCommand {
    }

    record ConfirmShoppingCart(
        UUID shoppingCartId,
        Instant now
    ) implements ShoppingCartCommand {
    }

    record CancelShoppingCart(
        UUID shoppingCartId,
        Instant now
    ) implements ShoppingCartCommand {
    }
}
