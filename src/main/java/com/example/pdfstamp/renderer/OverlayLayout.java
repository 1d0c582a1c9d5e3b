package com.example.pdfstamp.renderer;

import com.example.pdfstamp.exception.DocumentStampingException;
import com.example.pdfstamp.model.Alignment;
import com.example.pdfstamp.model.FieldInstruction;
import com.example.pdfstamp.model.FinalTotal;
import com.example.pdfstamp.model.ItemColumns;
import com.example.pdfstamp.model.ItemsList;
import com.example.pdfstamp.model.LineItem;
import com.example.pdfstamp.model.StaticText;
import org.apache.pdfbox.pdmodel.font.PDFont;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns the instructions of one page into draw origins.
 *
 * Item rows are not paginated: a table longer than the page keeps moving down
 * and rows below the bottom edge are simply not visible.
 */
public class OverlayLayout {

    private final PDFont font;
    private final float fontSize;

    public OverlayLayout(PDFont font, float fontSize) {
        this.font = font;
        this.fontSize = fontSize;
    }

    public List<PlacedText> layout(List<FieldInstruction> instructions) {
        List<PlacedText> placed = new ArrayList<>();
        Float lastRowY = null;

        for (FieldInstruction instruction : instructions) {
            if (instruction instanceof StaticText staticText) {
                placed.add(placeStaticText(staticText));
            } else if (instruction instanceof ItemsList itemsList) {
                ItemColumns columns = itemsList.getColumns();
                float y = itemsList.getStartY();
                for (LineItem row : itemsList.getRows()) {
                    placed.add(new PlacedText(drawable(row.getName()), columns.getNameX(), y));
                    placed.add(new PlacedText(drawable(row.getQty()), columns.getQtyX(), y));
                    placed.add(new PlacedText(drawable(row.getPrice()), columns.getPriceX(), y));
                    placed.add(new PlacedText(drawable(row.getTotal()), columns.getTotalX(), y));
                    lastRowY = y;
                    y -= itemsList.getLineHeight();
                }
            } else if (instruction instanceof FinalTotal total) {
                // only meaningful below at least one drawn row
                if (total.hasValue() && lastRowY != null) {
                    float y = lastRowY - 2 * total.getLineHeight();
                    placed.add(new PlacedText(drawable("Total: " + total.getValue()), total.getX(), y));
                }
            }
        }
        return placed;
    }

    PlacedText placeStaticText(StaticText field) {
        String text = drawable(field.getText());
        float x = field.getX();
        if (field.getAlign() == Alignment.CENTER) {
            x -= textWidth(text) / 2;
        }
        return new PlacedText(text, x, field.getY());
    }

    public float textWidth(String text) {
        try {
            return font.getStringWidth(text) / 1000f * fontSize;
        } catch (IOException e) {
            throw new DocumentStampingException("Failed to measure text width", e);
        }
    }

    /**
     * Replaces characters the font cannot encode (line breaks included) with '?'.
     */
    String drawable(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder result = new StringBuilder(text.length());
        text.codePoints().forEach(codePoint -> {
            String character = new String(Character.toChars(codePoint));
            result.append(canEncode(character) ? character : "?");
        });
        return result.toString();
    }

    private boolean canEncode(String character) {
        try {
            font.encode(character);
            return true;
        } catch (IllegalArgumentException | IOException e) {
            return false;
        }
    }
}
