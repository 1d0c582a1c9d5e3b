package com.example.pdfstamp.model;

import lombok.Value;

import java.util.Map;

/**
 * One row of the items table. Every column is already rendered to text;
 * missing columns become empty strings.
 */
@Value
public class LineItem {
    String name;
    String qty;
    String price;
    String total;

    public static LineItem fromMap(Map<?, ?> row) {
        return new LineItem(
                StampContext.asText(row.get("name")),
                StampContext.asText(row.get("qty")),
                StampContext.asText(row.get("price")),
                StampContext.asText(row.get("total")));
    }
}
