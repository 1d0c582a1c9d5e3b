package com.example.pdfstamp.model;

import lombok.Value;

import java.util.List;

/**
 * All item rows of a context, drawn top-down from {@code startY}.
 */
@Value
public class ItemsList implements FieldInstruction {
    List<LineItem> rows;
    ItemColumns columns;
    float startY;
    float lineHeight;

    public ItemsList(List<LineItem> rows, ItemColumns columns, float startY, float lineHeight) {
        this.rows = List.copyOf(rows);
        this.columns = columns;
        this.startY = startY;
        this.lineHeight = lineHeight;
    }
}
