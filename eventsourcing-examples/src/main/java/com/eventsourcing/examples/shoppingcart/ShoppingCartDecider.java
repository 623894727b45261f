package com.eventsourcing.examples.shoppingcart;

import com.eventsourcing.core.aggregate.Decider;
import com.eventsourcing.examples.shoppingcart.ShoppingCartCommand.AddProductItemToShoppingCart;
import com.eventsourcing.examples.shoppingcart.ShoppingCartCommand.CancelShoppingCart;
import com.eventsourcing.examples.shoppingcart.ShoppingCartCommand.ConfirmShoppingCart;
import com.eventsourcing.examples.shoppingcart.ShoppingCartCommand.OpenShoppingCart;
import com.eventsourcing.examples.shoppingcart.ShoppingCartCommand.RemoveProductItemFromShoppingCart;
import com.eventsourcing.examples.shoppingcart.ShoppingCartEvent.ProductItemAddedToShoppingCart;
import com.eventsourcing.examples.shoppingcart.ShoppingCartEvent.ProductItemRemovedFromShoppingCart;
import com.eventsourcing.examples.shoppingcart.ShoppingCartEvent.ShoppingCartCanceled;
import com.eventsourcing.examples.shoppingcart.ShoppingCartEvent.ShoppingCartConfirmed;
import com.eventsourcing.examples.shoppingcart.ShoppingCartEvent.ShoppingCartOpened;

import java.util.List;

/**
 * Business rules of a shopping cart.
 *
 * Rules:
 * - A cart can be opened only once
 * - Every other command needs an existing cart
 * - Items can be added or removed only while the cart is PENDING
 * - Adding must not push a line's quantity past {@link Integer#MAX_VALUE}
 * - Removing needs a line with the same product and price holding at least that quantity
 * - Confirm and cancel are allowed only while PENDING, and close the cart for good
 *
 * Every accepted command produces exactly one event.
 */
public class ShoppingCartDecider implements Decider<ShoppingCartCommand, ShoppingCart, ShoppingCartEvent> {

    @Override
    public List<ShoppingCartEvent> decide(ShoppingCartCommand command, ShoppingCart state) {
        if (command instanceof OpenShoppingCart open) {
            if (state != null) {
                throw new ShoppingCartException(ShoppingCartError.OPENED_EXISTING_CART, open.shoppingCartId());
            }
            return List.of(new ShoppingCartOpened(open.shoppingCartId(), open.clientId(), open.now()));
        }

        ShoppingCart cart = requireOpen(command, state);

        if (command instanceof AddProductItemToShoppingCart add) {
            if (!fitsInLine(cart, add.productItem())) {
                throw new ShoppingCartException(ShoppingCartError.PRODUCT_ITEM_QUANTITY_TOO_LARGE, add.shoppingCartId());
            }
            return List.of(new ProductItemAddedToShoppingCart(add.shoppingCartId(), add.productItem()));
        }
        if (command instanceof RemoveProductItemFromShoppingCart remove) {
            if (!cart.productItems().hasEnough(remove.productItem())) {
                throw new ShoppingCartException(ShoppingCartError.PRODUCT_ITEM_NOT_FOUND, remove.shoppingCartId());
            }
            return List.of(new ProductItemRemovedFromShoppingCart(remove.shoppingCartId(), remove.productItem()));
        }
        if (command instanceof ConfirmShoppingCart confirm) {
            return List.of(new ShoppingCartConfirmed(confirm.shoppingCartId(), confirm.now()));
        }
        if (command instanceof CancelShoppingCart cancel) {
            return List.of(new ShoppingCartCanceled(cancel.shoppingCartId(), cancel.now()));
        }
        throw new IllegalArgumentException("Unknown shopping cart command: " + command);
    }

    private static boolean fitsInLine(ShoppingCart cart, PricedProductItem item) {
        return cart.productItems().find(item.productId(), item.unitPrice())
            .map(line -> (long) line.quantity() + item.quantity() <= Integer.MAX_VALUE)
            .orElse(true);
    }

    private static ShoppingCart requireOpen(ShoppingCartCommand command, ShoppingCart state) {
        if (state == null) {
            throw new ShoppingCartException(ShoppingCartError.CART_NOT_FOUND, command.shoppingCartId());
        }
        if (state.isClosed()) {
            throw new ShoppingCartException(ShoppingCartError.CART_IS_ALREADY_CLOSED, command.shoppingCartId());
        }
        return state;
    }
}
