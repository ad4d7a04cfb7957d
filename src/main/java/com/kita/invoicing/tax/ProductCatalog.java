package com.kita.invoicing.tax;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * SAT product/service and unit classification codes used on concepts
 */
public final class ProductCatalog {

    private ProductCatalog() {
        // Utility class
    }

    /**
     * One catalog entry
     */
    public static final class Entry {
        private final String productKey;
        private final String productName;
        private final String unitKey;
        private final String unitName;

        public Entry(String productKey, String productName, String unitKey, String unitName) {
            this.productKey = productKey;
            this.productName = productName;
            this.unitKey = unitKey;
            this.unitName = unitName;
        }

        public String getProductKey() { return productKey; }
        public String getProductName() { return productName; }
        public String getUnitKey() { return unitKey; }
        public String getUnitName() { return unitName; }
    }

    /** Billing services, one activity */
    public static final Entry BILLING_SERVICE = new Entry("84111506", "Servicios de facturación", "ACT", "Actividad");

    public static final Entry SERVICE_UNIT = new Entry("80141600", "Actividades de ventas y promoción de negocios", "E48", "Unidad de servicio");

    public static final Entry PIECE = new Entry("01010101", "No existe en el catálogo", "H87", "Pieza");

    /** Entry used for payment-backed invoices */
    public static final Entry DEFAULT = BILLING_SERVICE;

    private static final Map<String, Entry> BY_PRODUCT_KEY;

    static {
        Map<String, Entry> map = new LinkedHashMap<>();
        map.put(BILLING_SERVICE.getProductKey(), BILLING_SERVICE);
        map.put(SERVICE_UNIT.getProductKey(), SERVICE_UNIT);
        map.put(PIECE.getProductKey(), PIECE);
        BY_PRODUCT_KEY = Collections.unmodifiableMap(map);
    }

    public static Optional<Entry> find(String productKey) {
        return Optional.ofNullable(BY_PRODUCT_KEY.get(productKey));
    }

    public static Map<String, Entry> entries() {
        return BY_PRODUCT_KEY;
    }
}
