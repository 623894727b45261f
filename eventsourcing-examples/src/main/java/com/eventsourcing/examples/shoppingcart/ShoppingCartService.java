package com.eventsourcing.examples.shoppingcart;

import com.eventsourcing.core.model.ExpectedRevision;
import com.eventsourcing.core.model.RecordedEvent;
import com.eventsourcing.core.model.RetryPolicy;
import com.eventsourcing.core.model.VersionedState;
import com.eventsourcing.core.repository.StreamStore;
import com.eventsourcing.engine.handler.CommandHandler;
import com.eventsourcing.engine.handler.CommandResult;
import com.eventsourcing.engine.metrics.EventStoreMetrics;
import com.eventsourcing.examples.shoppingcart.ShoppingCartCommand.AddProductItemToShoppingCart;
import com.eventsourcing.examples.shoppingcart.ShoppingCartCommand.CancelShoppingCart;
import com.eventsourcing.examples.shoppingcart.ShoppingCartCommand.ConfirmShoppingCart;
import com.eventsourcing.examples.shoppingcart.ShoppingCartCommand.OpenShoppingCart;
import com.eventsourcing.examples.shoppingcart.ShoppingCartCommand.RemoveProductItemFromShoppingCart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Application service for shopping carts.
 *
 * Each cart lives in its own stream named {@code shopping_cart-<cartId>}. Mutating operations
 * come in two flavours: without an expected revision they work against the latest state and
 * retry on concurrent modification; with one they fail if the cart changed since the caller
 * last read it.
 */
public class ShoppingCartService {

    private static final Logger log = LoggerFactory.getLogger(ShoppingCartService.class);

    public static final String STREAM_PREFIX = "shopping_cart-";

    private final StreamStore<ShoppingCartEvent> store;
    private final CommandHandler<ShoppingCartCommand, ShoppingCart, ShoppingCartEvent> handler;
    private final Clock clock;

    public ShoppingCartService(StreamStore<ShoppingCartEvent> store,
                               RetryPolicy retryPolicy,
                               EventStoreMetrics metrics,
                               Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.handler = new CommandHandler<>(
            store,
            ShoppingCart::evolve,
            ShoppingCart::initial,
            new ShoppingCartDecider(),
            retryPolicy,
            metrics
        );
    }

    public ShoppingCartService(StreamStore<ShoppingCartEvent> store) {
        this(store, RetryPolicy.defaultPolicy(), new EventStoreMetrics(), Clock.systemUTC());
    }

    public static String streamId(UUID shoppingCartId) {
        return STREAM_PREFIX + shoppingCartId;
    }

    // ========== Commands ==========

    /**
     * Open a new cart. An absent stream is expected, so a cart that already exists is
     * rejected by the decider with {@link ShoppingCartError#OPENED_EXISTING_CART}.
     */
    public CommandResult<ShoppingCartEvent> open(UUID shoppingCartId, UUID clientId) {
        CommandResult<ShoppingCartEvent> result = handler.handle(
            streamId(shoppingCartId),
            new OpenShoppingCart(shoppingCartId, clientId, clock.instant())
        );
        log.info("Opened shopping cart {} for client {}", shoppingCartId, clientId);
        return result;
    }

    public CommandResult<ShoppingCartEvent> addProductItem(UUID shoppingCartId, PricedProductItem productItem) {
        return addProductItem(shoppingCartId, productItem, null);
    }

    public CommandResult<ShoppingCartEvent> addProductItem(UUID shoppingCartId, PricedProductItem productItem,
                                                           ExpectedRevision expectedRevision) {
        CommandResult<ShoppingCartEvent> result = dispatch(
            new AddProductItemToShoppingCart(shoppingCartId, productItem), expectedRevision);
        log.info("Added {} x {} @ {} to shopping cart {}",
            productItem.quantity(), productItem.productId(), productItem.unitPrice(), shoppingCartId);
        return result;
    }

    public CommandResult<ShoppingCartEvent> removeProductItem(UUID shoppingCartId, PricedProductItem productItem) {
        return removeProductItem(shoppingCartId, productItem, null);
    }

    public CommandResult<ShoppingCartEvent> removeProductItem(UUID shoppingCartId, PricedProductItem productItem,
                                                              ExpectedRevision expectedRevision) {
        CommandResult<ShoppingCartEvent> result = dispatch(
            new RemoveProductItemFromShoppingCart(shoppingCartId, productItem), expectedRevision);
        log.info("Removed {} x {} @ {} from shopping cart {}",
            productItem.quantity(), productItem.productId(), productItem.unitPrice(), shoppingCartId);
        return result;
    }

    public CommandResult<ShoppingCartEvent> confirm(UUID shoppingCartId) {
        return confirm(shoppingCartId, null);
    }

    public CommandResult<ShoppingCartEvent> confirm(UUID shoppingCartId, ExpectedRevision expectedRevision) {
        CommandResult<ShoppingCartEvent> result = dispatch(
            new ConfirmShoppingCart(shoppingCartId, clock.instant()), expectedRevision);
        log.info("Confirmed shopping cart {}", shoppingCartId);
        return result;
    }

    public CommandResult<ShoppingCartEvent> cancel(UUID shoppingCartId) {
        return cancel(shoppingCartId, null);
    }

    public CommandResult<ShoppingCartEvent> cancel(UUID shoppingCartId, ExpectedRevision expectedRevision) {
        CommandResult<ShoppingCartEvent> result = dispatch(
            new CancelShoppingCart(shoppingCartId, clock.instant()), expectedRevision);
        log.info("Canceled shopping cart {}", shoppingCartId);
        return result;
    }

    // ========== Queries ==========

    /**
     * Current state of a cart with the revision to send back as the next expectation.
     */
    public Optional<VersionedState<ShoppingCart>> get(UUID shoppingCartId) {
        return handler.load(streamId(shoppingCartId));
    }

    /**
     * Every event recorded for a cart, oldest first. Empty for an unknown cart.
     */
    public List<RecordedEvent<ShoppingCartEvent>> history(UUID shoppingCartId) {
        return store.readRecordedEvents(streamId(shoppingCartId));
    }

    private CommandResult<ShoppingCartEvent> dispatch(ShoppingCartCommand command, ExpectedRevision expectedRevision) {
        String streamId = streamId(command.shoppingCartId());
        return expectedRevision == null
            ? handler.handle(streamId, command)
            : handler.handle(streamId, command, expectedRevision);
    }
}
