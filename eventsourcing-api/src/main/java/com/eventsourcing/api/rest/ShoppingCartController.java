package com.eventsourcing.api.rest;

import com.eventsourcing.core.model.VersionedState;
import com.eventsourcing.engine.handler.CommandResult;
import com.eventsourcing.examples.shoppingcart.PricedProductItem;
import com.eventsourcing.examples.shoppingcart.ShoppingCart;
import com.eventsourcing.examples.shoppingcart.ShoppingCartError;
import com.eventsourcing.examples.shoppingcart.ShoppingCartEvent;
import com.eventsourcing.examples.shoppingcart.ShoppingCartException;
import com.eventsourcing.examples.shoppingcart.ShoppingCartService;
import com.eventsourcing.examples.shoppingcart.ShoppingCartStatus;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * REST API for shopping carts.
 *
 * Every successful response carries the cart's stream revision as a weak ETag. Sending it back
 * in If-Match makes the change conditional on the cart not having moved since.
 */
@RestController
@RequestMapping("/api/v1/clients/{clientId}/shopping-carts")
public class ShoppingCartController {

    private final ShoppingCartService shoppingCartService;

    public ShoppingCartController(ShoppingCartService shoppingCartService) {
        this.shoppingCartService = shoppingCartService;
    }

    /**
     * Open a new cart for the client.
     */
    @PostMapping
    public ResponseEntity<Void> open(@PathVariable UUID clientId) {
        UUID shoppingCartId = UUID.randomUUID();
        CommandResult<ShoppingCartEvent> result = shoppingCartService.open(shoppingCartId, clientId);

        URI location = ServletUriComponentsBuilder.fromCurrentRequest()
            .path("/{shoppingCartId}")
            .buildAndExpand(shoppingCartId)
            .toUri();
        return ResponseEntity.created(location)
            .eTag(ETags.fromRevision(result.nextExpectedRevision()))
            .build();
    }

    @PostMapping("/{shoppingCartId}/product-items")
    public ResponseEntity<Void> addProductItem(
            @PathVariable UUID clientId,
            @PathVariable UUID shoppingCartId,
            @RequestBody ProductItemRequest request,
            @RequestHeader(value = HttpHeaders.IF_MATCH, required = false) String ifMatch) {

        CommandResult<ShoppingCartEvent> result = shoppingCartService.addProductItem(
            shoppingCartId, request.toProductItem(), ETags.toExpectedRevision(ifMatch));
        return noContent(result);
    }

    @DeleteMapping("/{shoppingCartId}/product-items")
    public ResponseEntity<Void> removeProductItem(
            @PathVariable UUID clientId,
            @PathVariable UUID shoppingCartId,
            @RequestParam String productId,
            @RequestParam int quantity,
            @RequestParam BigDecimal unitPrice,
            @RequestHeader(value = HttpHeaders.IF_MATCH, required = false) String ifMatch) {

        CommandResult<ShoppingCartEvent> result = shoppingCartService.removeProductItem(
            shoppingCartId, new PricedProductItem(productId, quantity, unitPrice), ETags.toExpectedRevision(ifMatch));
        return noContent(result);
    }

    @PostMapping("/{shoppingCartId}/confirm")
    public ResponseEntity<Void> confirm(
            @PathVariable UUID clientId,
            @PathVariable UUID shoppingCartId,
            @RequestHeader(value = HttpHeaders.IF_MATCH, required = false) String ifMatch) {

        return noContent(shoppingCartService.confirm(shoppingCartId, ETags.toExpectedRevision(ifMatch)));
    }

    /**
     * Cancel the cart. The stream is kept; the cart becomes closed.
     */
    @DeleteMapping("/{shoppingCartId}")
    public ResponseEntity<Void> cancel(
            @PathVariable UUID clientId,
            @PathVariable UUID shoppingCartId,
            @RequestHeader(value = HttpHeaders.IF_MATCH, required = false) String ifMatch) {

        return noContent(shoppingCartService.cancel(shoppingCartId, ETags.toExpectedRevision(ifMatch)));
    }

    /**
     * Current cart state. Carts of another client are reported as not found.
     */
    @GetMapping("/{shoppingCartId}")
    public ResponseEntity<ShoppingCartResponse> get(
            @PathVariable UUID clientId,
            @PathVariable UUID shoppingCartId) {

        VersionedState<ShoppingCart> current = shoppingCartService.get(shoppingCartId)
            .filter(versioned -> clientId.equals(versioned.state().clientId()))
            .orElseThrow(() -> new ShoppingCartException(ShoppingCartError.CART_NOT_FOUND, shoppingCartId));

        return ResponseEntity.ok()
            .eTag(ETags.fromRevision(current.revision()))
            .body(ShoppingCartResponse.from(current.state()));
    }

    private static ResponseEntity<Void> noContent(CommandResult<ShoppingCartEvent> result) {
        return ResponseEntity.noContent()
            .eTag(ETags.fromRevision(result.nextExpectedRevision()))
            .build();
    }

    // ========== DTOs ==========

    public record ProductItemRequest(
        String productId,
        Integer quantity,
        BigDecimal unitPrice
    ) {
        PricedProductItem toProductItem() {
            if (quantity == null) {
                throw new IllegalArgumentException("quantity is required");
            }
            return new PricedProductItem(productId, quantity, unitPrice);
        }
    }

    public record ProductItemResponse(
        String productId,
        int quantity,
        BigDecimal unitPrice,
        BigDecimal totalPrice
    ) {
        static ProductItemResponse from(PricedProductItem item) {
            return new ProductItemResponse(item.productId(), item.quantity(), item.unitPrice(), item.totalPrice());
        }
    }

    public record ShoppingCartResponse(
        UUID id,
        UUID clientId,
        ShoppingCartStatus status,
        List<ProductItemResponse> productItems,
        BigDecimal totalAmount,
        Instant openedAt,
        Instant confirmedAt,
        Instant canceledAt
    ) {
        static ShoppingCartResponse from(ShoppingCart cart) {
            return new ShoppingCartResponse(
                cart.id(),
                cart.clientId(),
                cart.status(),
                cart.productItems().items().stream()
                    .map(ProductItemResponse::from)
                    .toList(),
                cart.totalAmount(),
                cart.openedAt(),
                cart.confirmedAt(),
                cart.canceledAt()
            );
        }
    }
}
