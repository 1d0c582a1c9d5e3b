package com.example.pdfstamp.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Caller supplied data stamped onto the templates of one request.
 * Instances are immutable; derived values are added through {@link #with(String, Object)}
 * which returns a new context.
 */
public final class StampContext {

    public static final String ITEMS = "items";
    public static final String TOTAL = "total";
    public static final String DOC_DATE = "doc_date";
    public static final String CUSTOMER_ADDRESS = "customer_address";
    public static final String CUSTOMER_CITY = "customer_city";
    public static final String CUSTOMER_FULL_ADDRESS = "customer_full_address";
    public static final String CUSTOMER_NIPT = "customer_nipt";
    public static final String NIPT = "nipt";

    private final Map<String, Object> values;

    private StampContext(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static StampContext of(Map<String, ?> values) {
        return new StampContext(values == null ? new LinkedHashMap<>() : new LinkedHashMap<>(values));
    }

    public StampContext with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new StampContext(copy);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Object get(String key) {
        return values.get(key);
    }

    /**
     * Text form of a value, or empty when the key is absent.
     */
    public Optional<String> getText(String key) {
        if (!values.containsKey(key)) {
            return Optional.empty();
        }
        return Optional.of(asText(values.get(key)));
    }

    /**
     * Item rows in order. Anything that is not a list of objects yields no rows.
     */
    public List<LineItem> getItems() {
        Object raw = values.get(ITEMS);
        if (!(raw instanceof List)) {
            return List.of();
        }
        List<LineItem> rows = new ArrayList<>();
        for (Object row : (List<?>) raw) {
            if (row instanceof Map) {
                rows.add(LineItem.fromMap((Map<?, ?>) row));
            }
        }
        return rows;
    }

    /**
     * The total, or null when absent or empty.
     */
    public String getTotal() {
        Object raw = values.get(TOTAL);
        if (raw == null) {
            return null;
        }
        String text = asText(raw);
        return text.isEmpty() ? null : text;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    static String asText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                return String.valueOf(value);
            }
            // shortest decimal form, never scientific notation; whole numbers keep one decimal
            BigDecimal decimal = value instanceof Float
                    ? new BigDecimal(value.toString()).stripTrailingZeros()
                    : BigDecimal.valueOf(number).stripTrailingZeros();
            if (decimal.scale() < 1) {
                decimal = decimal.setScale(1);
            }
            return decimal.toPlainString();
        }
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StampContext)) return false;
        return values.equals(((StampContext) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "StampContext" + values.keySet();
    }
}
