package com.kita.invoicing.tax;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Transferred tax line (traslado)
 */
public final class TaxTransfer {

    /** SAT tax code for IVA */
    public static final String IVA = "002";
    public static final String FACTOR_RATE = "Tasa";

    private final BigDecimal base;
    private final BigDecimal amount;
    private final String taxCode;
    private final String factorType;
    private final BigDecimal rate;

    public TaxTransfer(BigDecimal base, BigDecimal amount, BigDecimal rate) {
        this(base, amount, IVA, FACTOR_RATE, rate);
    }

    public TaxTransfer(BigDecimal base, BigDecimal amount, String taxCode, String factorType, BigDecimal rate) {
        this.base = base;
        this.amount = amount;
        this.taxCode = taxCode;
        this.factorType = factorType;
        this.rate = rate;
    }

    public BigDecimal getBase() { return base; }
    public BigDecimal getAmount() { return amount; }
    public String getTaxCode() { return taxCode; }
    public String getFactorType() { return factorType; }
    public BigDecimal getRate() { return rate; }

    /**
     * Rate with six decimals, e.g. 0.160000
     */
    public String formattedRate() {
        return rate.setScale(6, RoundingMode.UNNECESSARY).toPlainString();
    }
}
