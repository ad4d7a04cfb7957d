package com.kita.invoicing.tax;

import com.kita.invoicing.model.PayerIdentity;
import com.kita.invoicing.model.TaxId;
import com.kita.invoicing.model.TenantProfile;

/**
 * Issuer (emisor) or recipient (receptor) of a tax document
 */
public final class Party {

    private final TaxId taxId;
    private final String name;
    private final String fiscalRegime;
    private final String postalCode;
    private final String cfdiUse;

    public Party(TaxId taxId, String name, String fiscalRegime, String postalCode, String cfdiUse) {
        this.taxId = taxId;
        this.name = name;
        this.fiscalRegime = fiscalRegime;
        this.postalCode = postalCode;
        this.cfdiUse = cfdiUse;
    }

    public static Party issuer(TenantProfile tenant) {
        return new Party(tenant.getTaxId(), tenant.getLegalName(), tenant.getFiscalRegime(),
            tenant.getPostalCode(), null);
    }

    public static Party recipient(PayerIdentity payer) {
        return new Party(payer.getTaxId(), payer.getLegalName(), payer.getFiscalRegime(),
            payer.getPostalCode(), payer.getCfdiUse());
    }

    public TaxId getTaxId() { return taxId; }
    public String getName() { return name; }
    public String getFiscalRegime() { return fiscalRegime; }
    public String getPostalCode() { return postalCode; }

    /**
     * CFDI use code, recipients only
     */
    public String getCfdiUse() { return cfdiUse; }
}
