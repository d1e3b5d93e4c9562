package com.example.docfix;

public record DownloadedDocument(String fileName, byte[] content) {}
