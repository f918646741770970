package com.archivist.taxonomy.batch;

public record BatchItem(
    String customId,
    String systemPrompt,
    String prompt,
    int maxTokens
) {}
