package com.kita.invoicing.tax;

import com.kita.invoicing.exception.ValidationException;
import com.kita.invoicing.model.InvoiceRequest;
import com.kita.invoicing.model.PayerIdentity;
import com.kita.invoicing.model.TenantProfile;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Converts a tax-inclusive payment into a CFDI income document
 *
 * <p>The subtotal is {@code total / (1 + rate)} rounded half-up to cents and
 * the tax is the residual {@code total - subtotal}, so the document always
 * adds up to the amount charged. Stateless and thread-safe.
 */
public class TaxDocumentBuilder {

    private static final int SCALE = 2;

    /**
     * Subtotal and tax of a tax-inclusive amount
     */
    public static final class Split {
        private final BigDecimal subtotal;
        private final BigDecimal tax;

        Split(BigDecimal subtotal, BigDecimal tax) {
            this.subtotal = subtotal;
            this.tax = tax;
        }

        public BigDecimal getSubtotal() { return subtotal; }
        public BigDecimal getTax() { return tax; }
    }

    /**
     * Split a tax-inclusive total
     *
     * @param total amount charged, positive, at most two decimals
     * @param rate tax rate in [0, 1)
     * @return subtotal and residual tax
     * @throws ValidationException on invalid total or rate
     */
    public static Split split(BigDecimal total, BigDecimal rate) {
        validateTotal(total, "total");
        validateRate(rate);
        BigDecimal amount = total.setScale(SCALE, RoundingMode.UNNECESSARY);
        BigDecimal subtotal = amount.divide(BigDecimal.ONE.add(rate), SCALE, RoundingMode.HALF_UP);
        return new Split(subtotal, amount.subtract(subtotal));
    }

    /**
     * Build a single-concept document for a payment
     */
    public TaxDocument build(TenantProfile issuer, PayerIdentity payer, BigDecimal total, BigDecimal rate,
                             int folio, String description, String paymentForm, String currency,
                             LocalDateTime issuedAt) {
        return build(issuer, payer, Collections.singletonList(new LineItem(description, total)), rate,
            folio, paymentForm, currency, issuedAt);
    }

    /**
     * Build a document for an invoice request
     */
    public TaxDocument build(TenantProfile issuer, InvoiceRequest request, int folio, LocalDateTime issuedAt) {
        return build(issuer, request.getPayer(), request.getAmount(), request.getTaxRate(), folio,
            request.getDescription(), request.getPaymentForm(), request.getCurrency(), issuedAt);
    }

    /**
     * Build a multi-concept document; each line is split on its own and totals are summed
     */
    public TaxDocument build(TenantProfile issuer, PayerIdentity payer, List<LineItem> lines, BigDecimal rate,
                             int folio, String paymentForm, String currency, LocalDateTime issuedAt) {
        if (lines == null || lines.isEmpty()) {
            throw new ValidationException("At least one line is required", "lines");
        }
        if (folio < 1) {
            throw new ValidationException("Folio must be positive", "folio");
        }
        validateRate(rate);

        List<Concept> concepts = new ArrayList<>();
        BigDecimal subtotal = BigDecimal.ZERO.setScale(SCALE);
        BigDecimal tax = BigDecimal.ZERO.setScale(SCALE);
        for (LineItem line : lines) {
            Split split = split(line.getTotal(), rate);
            concepts.add(concept(line, split, rate));
            subtotal = subtotal.add(split.getSubtotal());
            tax = tax.add(split.getTax());
        }
        BigDecimal total = subtotal.add(tax);

        return TaxDocument.builder()
            .serie(issuer.getTaxId().serie())
            .folio(formatFolio(folio))
            .issuedAt(issuedAt.withNano(0))
            .issuer(Party.issuer(issuer))
            .recipient(Party.recipient(payer))
            .concepts(concepts)
            .transfers(Collections.singletonList(new TaxTransfer(subtotal, tax, rate)))
            .subtotal(subtotal)
            .tax(tax)
            .total(total)
            .currency(currency != null ? currency : "MXN")
            .paymentForm(paymentForm != null ? paymentForm : InvoiceRequest.DEFAULT_PAYMENT_FORM)
            .recipientEmail(payer.getEmail())
            .build();
    }

    /**
     * Six-digit zero-padded folio
     */
    public static String formatFolio(int folio) {
        return String.format("%06d", folio);
    }

    private Concept concept(LineItem line, Split split, BigDecimal rate) {
        ProductCatalog.Entry product = line.getProduct();
        TaxTransfer transfer = new TaxTransfer(split.getSubtotal(), split.getTax(), rate);
        return new Concept(
            product.getProductKey(),
            BigDecimal.ONE,
            product.getUnitKey(),
            product.getUnitName(),
            line.getDescription(),
            split.getSubtotal(),
            split.getSubtotal(),
            BigDecimal.ZERO.setScale(SCALE),
            Concept.TAX_OBJECT_YES,
            Collections.singletonList(transfer));
    }

    private static void validateTotal(BigDecimal total, String field) {
        if (total == null || total.signum() <= 0) {
            throw new ValidationException("Amount must be greater than zero", field);
        }
        if (total.stripTrailingZeros().scale() > SCALE) {
            throw new ValidationException("Amount must have at most two decimals", field);
        }
    }

    private static void validateRate(BigDecimal rate) {
        if (rate == null || rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) >= 0) {
            throw new ValidationException("Tax rate must be between 0 and 1", "taxRate");
        }
        if (rate.stripTrailingZeros().scale() > 6) {
            throw new ValidationException("Tax rate must have at most six decimals", "taxRate");
        }
    }
}
