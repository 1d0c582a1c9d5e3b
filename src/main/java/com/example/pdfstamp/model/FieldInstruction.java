package com.example.pdfstamp.model;

/**
 * One renderable unit bound to a template page.
 */
public sealed interface FieldInstruction permits StaticText, ItemsList, FinalTotal {
}
