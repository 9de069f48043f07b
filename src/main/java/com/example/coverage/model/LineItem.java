package com.example.coverage.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One row of a repair cost estimate, as produced by the extraction stage.
 *
 * @param description raw description (German, French or English)
 * @param itemType    parts, labor or fee
 * @param totalPrice  line total, VAT excluded
 * @param partCode    optional catalog identifier
 */
public record LineItem(
        String description,
        ItemType itemType,
        BigDecimal totalPrice,
        String partCode
) {
    public LineItem {
        Objects.requireNonNull(itemType, "itemType");
        if (description == null) description = "";
        if (totalPrice == null) totalPrice = BigDecimal.ZERO;
        if (partCode != null && partCode.isBlank()) partCode = null;
    }

    public static LineItem of(String description, ItemType itemType, String totalPrice) {
        return new LineItem(description, itemType, new BigDecimal(totalPrice), null);
    }

    public LineItem withPartCode(String code) {
        return new LineItem(description, itemType, totalPrice, code);
    }
}
