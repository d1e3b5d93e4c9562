package com.example.docfix;

public class DocumentUnreadableException extends DocFixException {

    public DocumentUnreadableException(long userId) {
        super("The document of user " + userId + " could not be read. Please upload it again.");
    }
}
