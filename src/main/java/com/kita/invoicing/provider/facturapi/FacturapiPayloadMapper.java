package com.kita.invoicing.provider.facturapi;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kita.invoicing.model.TenantProfile;
import com.kita.invoicing.tax.Concept;
import com.kita.invoicing.tax.Party;
import com.kita.invoicing.tax.TaxDocument;
import com.kita.invoicing.tax.TaxTransfer;

/**
 * Builds Facturapi request bodies
 *
 * <p>Facturapi uses the authenticated organization as issuer, so invoice
 * bodies carry only the customer (recipient) and the items.
 */
final class FacturapiPayloadMapper {

    static final String DEFAULT_ZIP = "00000";
    static final String DEFAULT_TAX_SYSTEM = "601";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private FacturapiPayloadMapper() {
    }

    static ObjectNode organization(TenantProfile tenant) {
        ObjectNode body = NODES.objectNode();
        body.put("name", tenant.getLegalName());
        return body;
    }

    static ObjectNode legal(TenantProfile tenant) {
        TenantProfile.Address address = tenant.getAddress();
        ObjectNode body = NODES.objectNode();
        body.put("name", tenant.getLegalName());
        body.put("legal_name", tenant.getLegalName());
        body.put("tax_system", orDefault(tenant.getFiscalRegime(), DEFAULT_TAX_SYSTEM));
        body.put("phone", orDefault(tenant.getPhone(), ""));

        ObjectNode addressNode = body.putObject("address");
        addressNode.put("street", address != null ? orDefault(address.getStreet(), "") : "");
        addressNode.put("exterior", address != null ? orDefault(address.getExterior(), "") : "");
        addressNode.put("interior", address != null ? orDefault(address.getInterior(), "") : "");
        addressNode.put("neighborhood", address != null ? orDefault(address.getNeighborhood(), "") : "");
        addressNode.put("city", address != null ? orDefault(address.getCity(), "") : "");
        addressNode.put("municipality", address != null ? orDefault(address.getMunicipality(), "") : "");
        addressNode.put("zip", zipOf(tenant));
        addressNode.put("state", address != null ? orDefault(address.getState(), "") : "");
        return body;
    }

    static ObjectNode invoice(TaxDocument document) {
        Party recipient = document.getRecipient();
        ObjectNode body = NODES.objectNode();

        ObjectNode customer = body.putObject("customer");
        customer.put("legal_name", recipient.getName());
        customer.put("tax_id", recipient.getTaxId().getValue());
        customer.put("tax_system", orDefault(recipient.getFiscalRegime(), DEFAULT_TAX_SYSTEM));
        if (document.getRecipientEmail() != null) {
            customer.put("email", document.getRecipientEmail());
        }
        customer.putObject("address").put("zip", orDefault(recipient.getPostalCode(), DEFAULT_ZIP));

        ArrayNode items = body.putArray("items");
        for (Concept concept : document.getConcepts()) {
            ObjectNode item = items.addObject();
            item.put("quantity", concept.getQuantity());
            ObjectNode product = item.putObject("product");
            product.put("description", concept.getDescription());
            product.put("product_key", concept.getProductKey());
            product.put("price", concept.getUnitValue());
            product.put("tax_included", false);
            product.put("unit_key", concept.getUnitKey());
            product.put("unit_name", concept.getUnitName());
            ArrayNode taxes = product.putArray("taxes");
            for (TaxTransfer transfer : concept.getTransfers()) {
                ObjectNode tax = taxes.addObject();
                tax.put("type", "IVA");
                tax.put("rate", transfer.getRate());
            }
        }

        body.put("payment_form", document.getPaymentForm());
        body.put("payment_method", document.getPaymentMethod());
        body.put("use", document.getCfdiUse());
        body.put("currency", document.getCurrency());
        body.put("series", document.getSerie());
        body.put("folio_number", Integer.parseInt(document.getFolio()));
        return body;
    }

    private static String zipOf(TenantProfile tenant) {
        if (tenant.getAddress() != null && tenant.getAddress().getZip() != null) {
            return tenant.getAddress().getZip();
        }
        return orDefault(tenant.getPostalCode(), DEFAULT_ZIP);
    }

    private static String orDefault(String value, String fallback) {
        return value != null && !value.isEmpty() ? value : fallback;
    }
}
