package com.example.docfix;

public class DocumentValidationException extends DocFixException {

    public DocumentValidationException(String reason) {
        super(reason);
    }
}
