package com.example.pdfstamp.renderer;

import lombok.Value;

/**
 * A piece of text at its final draw origin.
 */
@Value
public class PlacedText {
    String text;
    float x;
    float y;
}
