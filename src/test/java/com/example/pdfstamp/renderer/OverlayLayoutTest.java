package com.example.pdfstamp.renderer;

import com.example.pdfstamp.model.Alignment;
import com.example.pdfstamp.model.FieldInstruction;
import com.example.pdfstamp.model.FinalTotal;
import com.example.pdfstamp.model.ItemColumns;
import com.example.pdfstamp.model.ItemsList;
import com.example.pdfstamp.model.LineItem;
import com.example.pdfstamp.model.StaticText;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Overlay Layout Tests")
public class OverlayLayoutTest {

    private static final ItemColumns COLUMNS = new ItemColumns(50, 300, 380, 460);

    private final OverlayLayout layout = new OverlayLayout(PDType1Font.HELVETICA, 12f);

    private static List<LineItem> rows(int count) {
        LineItem row = new LineItem("Widget", "1", "10", "10");
        return java.util.Collections.nCopies(count, row);
    }

    @Test
    @DisplayName("Left aligned text is drawn at x")
    public void testLeftAlignment() {
        List<PlacedText> placed = layout.layout(List.of(new StaticText("Acme", 72, 700, Alignment.LEFT)));

        assertEquals(List.of(new PlacedText("Acme", 72, 700)), placed);
    }

    @Test
    @DisplayName("Centered text is shifted left by half its width")
    public void testCenterAlignment() {
        float width = layout.textWidth("INVOICE");
        assertTrue(width > 0);

        PlacedText placed = layout.layout(List.of(new StaticText("INVOICE", 306, 760, Alignment.CENTER))).get(0);

        assertEquals(306 - width / 2, placed.getX(), 0.001f);
        assertEquals(760f, placed.getY());
    }

    @Test
    @DisplayName("Rows move down by the line height and the total sits two lines below the last row")
    public void testRowsAndTotal() {
        List<FieldInstruction> instructions = List.of(
                new ItemsList(rows(3), COLUMNS, 700, 20),
                new FinalTotal("30", 50, 20));

        List<PlacedText> placed = layout.layout(instructions);

        assertEquals(13, placed.size());
        assertEquals(new PlacedText("Widget", 50, 700), placed.get(0));
        assertEquals(new PlacedText("1", 300, 700), placed.get(1));
        assertEquals(new PlacedText("10", 380, 700), placed.get(2));
        assertEquals(new PlacedText("10", 460, 700), placed.get(3));
        assertEquals(680f, placed.get(4).getY());
        assertEquals(660f, placed.get(8).getY());
        assertEquals(new PlacedText("Total: 30", 50, 620), placed.get(12));
    }

    @Test
    @DisplayName("A total without a value is not drawn")
    public void testTotalWithoutValue() {
        List<PlacedText> placed = layout.layout(List.of(
                new ItemsList(rows(1), COLUMNS, 700, 20),
                new FinalTotal(null, 50, 20)));

        assertEquals(4, placed.size());
    }

    @Test
    @DisplayName("A total without any drawn row is not drawn")
    public void testTotalWithoutRows() {
        List<PlacedText> placed = layout.layout(List.of(
                new ItemsList(List.of(), COLUMNS, 700, 20),
                new FinalTotal("30", 50, 20)));

        assertTrue(placed.isEmpty());
    }

    @Test
    @DisplayName("Rows past the bottom edge keep their computed, negative coordinates")
    public void testOverflowRowsAreNotPaginated() {
        List<PlacedText> placed = layout.layout(List.of(new ItemsList(rows(3), COLUMNS, 30, 20)));

        assertEquals(12, placed.size());
        assertEquals(30f, placed.get(0).getY());
        assertEquals(10f, placed.get(4).getY());
        assertEquals(-10f, placed.get(8).getY());
    }

    @Test
    @DisplayName("Characters the font cannot encode are replaced")
    public void testUnencodableCharacters() {
        assertEquals("Tiran?", layout.drawable("Tiran中"));
        assertEquals("", layout.drawable(null));
    }
}
