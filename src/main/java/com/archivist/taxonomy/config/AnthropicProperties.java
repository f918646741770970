package com.archivist.taxonomy.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.anthropic")
public record AnthropicProperties(
    @NotBlank String apiKey,
    @NotBlank String baseUrl,
    @NotBlank String model,
    @NotBlank String version,
    @DecimalMin("0.0") @DecimalMax("1.0") double temperature
) {}
