package com.example.docfix;

public class SessionNotFoundException extends DocFixException {

    public SessionNotFoundException(long userId) {
        super("No active session for user " + userId + ". Start a new session first.");
    }
}
