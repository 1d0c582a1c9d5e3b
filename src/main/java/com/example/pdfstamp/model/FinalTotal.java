package com.example.pdfstamp.model;

import lombok.Value;

/**
 * Total line printed under the items table. Its y coordinate is only known once
 * the rows have been laid out: two line heights below the last row.
 * A null value means nothing is drawn.
 */
@Value
public class FinalTotal implements FieldInstruction {
    String value;
    float x;
    float lineHeight;

    public boolean hasValue() {
        return value != null && !value.isEmpty();
    }
}
