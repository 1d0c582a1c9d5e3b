package com.example.pdfstamp.exception;

public class ContractStorageException extends RuntimeException {

    public ContractStorageException(String message) {
        super(message);
    }

    public ContractStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
