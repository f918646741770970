package com.archivist.taxonomy.controller;

public record ErrorResponse(
    String message,
    int status,
    long timestamp
) {}
