package com.example.docfix;

public enum UsageStatus {
    OK,
    LIMIT_WARNING,
    LIMIT_REACHED
}
