package com.kita.invoicing.tax;

import java.math.BigDecimal;
import java.util.List;

/**
 * Line of a tax document (concepto)
 */
public final class Concept {

    /** Subject to tax */
    public static final String TAX_OBJECT_YES = "02";

    private final String productKey;
    private final BigDecimal quantity;
    private final String unitKey;
    private final String unitName;
    private final String description;
    private final BigDecimal unitValue;
    private final BigDecimal amount;
    private final BigDecimal discount;
    private final String taxObject;
    private final List<TaxTransfer> transfers;

    public Concept(String productKey, BigDecimal quantity, String unitKey, String unitName, String description,
                   BigDecimal unitValue, BigDecimal amount, BigDecimal discount, String taxObject,
                   List<TaxTransfer> transfers) {
        this.productKey = productKey;
        this.quantity = quantity;
        this.unitKey = unitKey;
        this.unitName = unitName;
        this.description = description;
        this.unitValue = unitValue;
        this.amount = amount;
        this.discount = discount;
        this.taxObject = taxObject;
        this.transfers = List.copyOf(transfers);
    }

    public String getProductKey() { return productKey; }
    public BigDecimal getQuantity() { return quantity; }
    public String getUnitKey() { return unitKey; }
    public String getUnitName() { return unitName; }
    public String getDescription() { return description; }
    public BigDecimal getUnitValue() { return unitValue; }
    public BigDecimal getAmount() { return amount; }
    public BigDecimal getDiscount() { return discount; }
    public String getTaxObject() { return taxObject; }
    public List<TaxTransfer> getTransfers() { return transfers; }

    /**
     * Amount plus transferred taxes
     */
    public BigDecimal totalWithTax() {
        BigDecimal sum = amount;
        for (TaxTransfer transfer : transfers) {
            sum = sum.add(transfer.getAmount());
        }
        return sum;
    }
}
