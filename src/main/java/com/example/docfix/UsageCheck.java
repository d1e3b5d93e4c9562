package com.example.docfix;

public record UsageCheck(boolean allowed, int remaining, UsageStatus status) {}
