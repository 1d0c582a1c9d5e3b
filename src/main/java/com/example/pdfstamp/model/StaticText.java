package com.example.pdfstamp.model;

import lombok.Value;

@Value
public class StaticText implements FieldInstruction {
    String text;
    float x;
    float y;
    Alignment align;
}
