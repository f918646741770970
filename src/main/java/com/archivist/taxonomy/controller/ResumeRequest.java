package com.archivist.taxonomy.controller;

import jakarta.validation.constraints.NotBlank;

public record ResumeRequest(
    @NotBlank
    String stage,

    boolean force
) {}
