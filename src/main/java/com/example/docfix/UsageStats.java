package com.example.docfix;

public record UsageStats(int used, int limit) {}
