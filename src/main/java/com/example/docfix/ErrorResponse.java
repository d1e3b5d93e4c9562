package com.example.docfix;

public record ErrorResponse(String code, String message) {}
