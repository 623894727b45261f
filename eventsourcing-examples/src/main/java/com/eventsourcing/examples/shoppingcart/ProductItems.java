package com.eventsourcing.examples.shoppingcart;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable list of cart lines, at most one per (productId, unitPrice), in the order
 * the lines were first added.
 */
public record ProductItems(List<PricedProductItem> items) {

    private static final ProductItems EMPTY = new ProductItems(List.of());

    public ProductItems {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static ProductItems empty() {
        return EMPTY;
    }

    /**
     * Add an item, merging its quantity into an existing line with the same product and price.
     *
     * @throws ArithmeticException if the merged quantity does not fit in an int
     */
    public ProductItems add(PricedProductItem item) {
        List<PricedProductItem> next = new ArrayList<>(items.size() + 1);
        boolean merged = false;
        for (PricedProductItem line : items) {
            if (!merged && line.sameLineAs(item)) {
                next.add(line.withQuantity(Math.addExact(line.quantity(), item.quantity())));
                merged = true;
            } else {
                next.add(line);
            }
        }
        if (!merged) {
            next.add(item);
        }
        return new ProductItems(next);
    }

    /**
     * Subtract an item's quantity from its line. A line reaching zero is dropped.
     * Removing more than the line holds drops the line.
     */
    public ProductItems remove(PricedProductItem item) {
        List<PricedProductItem> next = new ArrayList<>(items.size());
        for (PricedProductItem line : items) {
            if (line.sameLineAs(item)) {
                int remaining = line.quantity() - item.quantity();
                if (remaining > 0) {
                    next.add(line.withQuantity(remaining));
                }
            } else {
                next.add(line);
            }
        }
        return new ProductItems(next);
    }

    public Optional<PricedProductItem> find(String productId, BigDecimal unitPrice) {
        return items.stream()
            .filter(line -> line.productId().equals(productId) && line.unitPrice().compareTo(unitPrice) == 0)
            .findFirst();
    }

    /**
     * True when a matching line holds at least the item's quantity.
     */
    public boolean hasEnough(PricedProductItem item) {
        return find(item.productId(), item.unitPrice())
            .map(line -> line.quantity() >= item.quantity())
            .orElse(false);
    }

    public BigDecimal totalAmount() {
        return items.stream()
            .map(PricedProductItem::totalPrice)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
