package dev.pekelund.receiptscan.recognizer.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * One recognised line on a receipt.
 *
 * @param unitPrice price of a single unit, positive for recognised items
 * @param quantity number of units, at least 1
 * @param totalPrice {@code unitPrice * quantity}
 * @param placeholder {@code true} for items produced by a fallback strategy that the user still has to fill in;
 *     those may carry a zero price
 */
public record LineItem(String name, BigDecimal unitPrice, int quantity, BigDecimal totalPrice,
    boolean placeholder) {

    public LineItem {
        name = name != null ? name : "";
        Objects.requireNonNull(unitPrice, "unitPrice must not be null");
        if (quantity < 1) {
            throw new IllegalArgumentException("quantity must be at least 1");
        }
        unitPrice = unitPrice.setScale(2, RoundingMode.HALF_UP);
        totalPrice = totalPrice != null
            ? totalPrice.setScale(2, RoundingMode.HALF_UP)
            : unitPrice.multiply(BigDecimal.valueOf(quantity)).setScale(2, RoundingMode.HALF_UP);
    }

    public static LineItem recognised(String name, BigDecimal unitPrice, int quantity) {
        return new LineItem(name, unitPrice, quantity, null, false);
    }

    public static LineItem placeholder(String name, BigDecimal unitPrice) {
        return new LineItem(name, unitPrice, 1, null, true);
    }
}
