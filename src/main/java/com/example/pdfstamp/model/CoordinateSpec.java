package com.example.pdfstamp.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field layout of one template, as declared in the coordinate catalog.
 *
 * <pre>
 * "invoice": {
 *   "static_fields": {
 *     "customer_name": { "page": 1, "x": 72, "y": 700, "align": "left" }
 *   },
 *   "items_section": {
 *     "page": 1, "start_y": 600, "line_height": 20,
 *     "columns": { "name_x": 72, "qty_x": 300, "price_x": 380, "total_x": 460 }
 *   }
 * }
 * </pre>
 *
 * Static fields keep their declaration order, which is also their drawing order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CoordinateSpec {

    @Builder.Default
    @JsonProperty("static_fields")
    private LinkedHashMap<String, FieldPosition> staticFields = new LinkedHashMap<>();

    /**
     * Optional table region; null when the template has no items table
     */
    @JsonProperty("items_section")
    private ItemsSection itemsSection;

    public Map<String, FieldPosition> getStaticFields() {
        if (staticFields == null) {
            staticFields = new LinkedHashMap<>();
        }
        return staticFields;
    }

    public boolean hasItemsSection() {
        return itemsSection != null;
    }
}
