package com.example.pdfstamp.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Horizontal offsets of the four columns of an items table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ItemColumns {
    @JsonProperty("name_x")
    private float nameX;

    @JsonProperty("qty_x")
    private float qtyX;

    @JsonProperty("price_x")
    private float priceX;

    @JsonProperty("total_x")
    private float totalX;
}
