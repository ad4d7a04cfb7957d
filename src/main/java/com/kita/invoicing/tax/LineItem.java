package com.kita.invoicing.tax;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Tax-inclusive line of a multi-line document
 */
public final class LineItem {

    private final String description;
    private final BigDecimal total;
    private final ProductCatalog.Entry product;

    public LineItem(String description, BigDecimal total) {
        this(description, total, ProductCatalog.DEFAULT);
    }

    public LineItem(String description, BigDecimal total, ProductCatalog.Entry product) {
        this.description = Objects.requireNonNull(description, "description");
        this.total = Objects.requireNonNull(total, "total");
        this.product = Objects.requireNonNull(product, "product");
    }

    public String getDescription() { return description; }
    public BigDecimal getTotal() { return total; }
    public ProductCatalog.Entry getProduct() { return product; }
}
