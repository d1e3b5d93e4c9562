package com.example.docfix;

/** 交给外部分析器的全文，以及本次计数后的额度状态 */
public record AnalysisText(String text, int remaining, UsageStatus status) {}
