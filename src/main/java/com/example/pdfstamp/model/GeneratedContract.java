package com.example.pdfstamp.model;

import lombok.Value;

/**
 * Assembled output document of one request together with the key it was filed under.
 */
@Value
public class GeneratedContract {
    String storageKey;
    byte[] content;
    int pageCount;
}
