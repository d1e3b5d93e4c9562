package com.example.docfix;

public class NoDocumentException extends DocFixException {

    public NoDocumentException(long userId) {
        super("Session of user " + userId + " has no document. Upload a .docx file first.");
    }
}
