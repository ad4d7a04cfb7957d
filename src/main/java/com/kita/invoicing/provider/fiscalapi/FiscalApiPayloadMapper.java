package com.kita.invoicing.provider.fiscalapi;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kita.invoicing.model.TenantProfile;
import com.kita.invoicing.tax.Concept;
import com.kita.invoicing.tax.Party;
import com.kita.invoicing.tax.TaxDocument;
import com.kita.invoicing.tax.TaxTransfer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.format.DateTimeFormatter;
import java.util.Base64;

/**
 * Builds FiscalAPI v4 request bodies
 */
final class FiscalApiPayloadMapper {

    private static final Logger logger = LoggerFactory.getLogger(FiscalApiPayloadMapper.class);

    static final int DEFAULT_TAX_REGIME = 612;
    static final int FILE_TYPE_CERTIFICATE = 0;
    static final int FILE_TYPE_PRIVATE_KEY = 1;

    private static final DateTimeFormatter CFDI_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private FiscalApiPayloadMapper() {
    }

    /**
     * Issuer person; the tenant is always created, never looked up
     */
    static ObjectNode issuerPerson(TenantProfile tenant) {
        ObjectNode body = NODES.objectNode();
        body.put("legalName", tenant.getLegalName());
        body.put("tin", tenant.getTaxId().getValue());
        if (tenant.getEmail() != null) {
            body.put("email", tenant.getEmail());
        }
        body.put("satTaxRegimeId", taxRegimeId(tenant.getFiscalRegime()));
        body.put("postalCode", tenant.getPostalCode());
        body.put("isIssuer", true);
        return body;
    }

    static ObjectNode taxFile(String personId, TenantProfile tenant, byte[] content, int fileType, String password) {
        ObjectNode body = NODES.objectNode();
        body.put("personId", personId);
        body.put("tin", tenant.getTaxId().getValue());
        body.put("base64File", Base64.getEncoder().encodeToString(content));
        body.put("fileType", fileType);
        body.put("password", password);
        return body;
    }

    static ObjectNode invoice(String issuerId, TaxDocument document) {
        Party recipient = document.getRecipient();
        ObjectNode body = NODES.objectNode();
        body.put("issuerId", issuerId);
        body.put("versionCode", document.getVersion());
        body.put("series", document.getSerie());
        body.put("number", document.getFolio());
        body.put("date", CFDI_DATE.format(document.getIssuedAt()));
        body.put("typeCode", document.getDocumentType());
        body.put("expeditionZipCode", document.getPlaceOfIssue());
        body.put("exportCode", document.getExportCode());
        body.put("paymentMethod", document.getPaymentMethod());
        body.put("paymentForm", document.getPaymentForm());
        body.put("currency", document.getCurrency());

        ObjectNode recipientNode = body.putObject("recipient");
        recipientNode.put("tin", recipient.getTaxId().getValue());
        recipientNode.put("legalName", recipient.getName());
        recipientNode.put("zipCode", recipient.getPostalCode());
        recipientNode.put("taxRegimeCode", recipient.getFiscalRegime());
        recipientNode.put("cfdiUseCode", recipient.getCfdiUse());
        if (document.getRecipientEmail() != null) {
            recipientNode.put("email", document.getRecipientEmail());
        }

        ArrayNode items = body.putArray("items");
        for (Concept concept : document.getConcepts()) {
            ObjectNode item = items.addObject();
            item.put("itemCode", concept.getProductKey());
            item.put("quantity", concept.getQuantity());
            item.put("unitOfMeasurementCode", concept.getUnitKey());
            item.put("description", concept.getDescription());
            item.put("unitPrice", concept.getUnitValue());
            item.put("discount", concept.getDiscount());
            item.put("taxObjectCode", concept.getTaxObject());
            ArrayNode taxes = item.putArray("itemTaxes");
            for (TaxTransfer transfer : concept.getTransfers()) {
                ObjectNode tax = taxes.addObject();
                tax.put("taxCode", transfer.getTaxCode());
                tax.put("taxTypeCode", transfer.getFactorType());
                tax.put("taxRate", transfer.formattedRate());
                tax.put("taxFlagCode", "T");
            }
        }
        return body;
    }

    static ObjectNode cancellation(String uuid, String reasonCode) {
        ObjectNode body = NODES.objectNode();
        body.put("uuid", uuid);
        body.put("reason", reasonCode);
        return body;
    }

    static int taxRegimeId(String fiscalRegime) {
        try {
            return Integer.parseInt(fiscalRegime);
        } catch (NumberFormatException e) {
            logger.warn("Fiscal regime '{}' is not numeric, using {}", fiscalRegime, DEFAULT_TAX_REGIME);
            return DEFAULT_TAX_REGIME;
        }
    }
}
