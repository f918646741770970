package com.archivist.taxonomy.controller;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record RecoverRequest(
    @NotEmpty List<@NotBlank String> handles
) {}
