package com.example.docfix;

public enum SessionMode {
    EDIT,
    ANALYZE,
    FIX
}
