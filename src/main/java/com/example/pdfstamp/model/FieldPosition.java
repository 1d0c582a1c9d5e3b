package com.example.pdfstamp.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Where a single static field is drawn.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldPosition {
    /**
     * 1-indexed page number within the template
     */
    @Builder.Default
    private int page = 1;

    private float x;

    private float y;

    @Builder.Default
    private Alignment align = Alignment.LEFT;
}
