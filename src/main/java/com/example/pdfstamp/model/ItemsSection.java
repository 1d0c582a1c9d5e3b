package com.example.pdfstamp.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Geometry of the single repeating-row region of a template.
 * Rows start at {@code startY} and move down by {@code lineHeight} each.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ItemsSection {
    /**
     * 1-indexed page number holding the table
     */
    @Builder.Default
    private int page = 1;

    @JsonProperty("start_y")
    private float startY;

    @JsonProperty("line_height")
    private float lineHeight;

    private ItemColumns columns;
}
