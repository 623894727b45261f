package com.eventsourcing.examples.shoppingcart;

import java.math.BigDecimal;

/**
 * A quantity of one product at one unit price.
 *
 * Two items are the same line when both productId and unitPrice match; unit prices
 * are compared numerically, so 100 and 100.00 are the same price.
 *
 * Invariants:
 * - productId is not blank
 * - quantity > 0
 * - unitPrice >= 0
 */
public record PricedProductItem(
    String productId,
    int quantity,
    BigDecimal unitPrice
) {
    public PricedProductItem {
        if (productId == null || productId.isBlank()) {
            throw new IllegalArgumentException("productId cannot be blank");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be > 0, got " + quantity);
        }
        if (unitPrice == null || unitPrice.signum() < 0) {
            throw new IllegalArgumentException("unitPrice must be >= 0, got " + unitPrice);
        }
    }

    public static PricedProductItem of(String productId, int quantity, String unitPrice) {
        return new PricedProductItem(productId, quantity, new BigDecimal(unitPrice));
    }

    public boolean sameLineAs(PricedProductItem other) {
        return productId.equals(other.productId) && unitPrice.compareTo(other.unitPrice) == 0;
    }

    public PricedProductItem withQuantity(int newQuantity) {
        return new PricedProductItem(productId, newQuantity, unitPrice);
    }

    public BigDecimal totalPrice() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }
}
