package com.archivist.taxonomy.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.pipeline")
public record PipelineProperties(
    @Valid @NotNull Triage triage,
    @Valid @NotNull Polling polling,
    @Valid @NotNull Embedding embedding,
    @Valid @NotNull Reduction reduction,
    @Valid @NotNull Clustering clustering,
    @Valid @NotNull Naming naming
) {

    public record Triage(
        @Min(1) @Max(10_000) int batchSize,
        @Min(100) int maxChars,
        @Min(16) int maxTokens
    ) {}

    public record Polling(
        @NotNull Duration initialInterval,
        @DecimalMin("1.0") double multiplier,
        @NotNull Duration maxInterval,
        @NotNull Duration maxDuration,
        @Min(1) int maxAttempts
    ) {}

    public record Embedding(
        @Min(1) @Max(250) int batchSize,
        @Min(100) int maxChars,
        @Min(1) int maxAttempts,
        @Min(0) long retryDelayMs,
        @Min(1) int requestsPerMinute
    ) {}

    public record Reduction(
        @Min(2) int targetDimensions,
        @Min(2) int neighbours,
        @Min(1) int threads
    ) {}

    public record Clustering(
        @Min(2) int minClusterSize,
        @DecimalMin("0.0") double epsilon,
        @DecimalMin("0.0") @DecimalMax("1.0") double epsilonPercentile,
        @Min(10) int epsilonSampleSize
    ) {}

    public record Naming(
        @Min(1) int sampleSize,
        @NotBlank String language,
        @Min(100) int maxCharsPerSample,
        @Min(16) int maxTokens,
        @NotBlank String reviewClusterName
    ) {}
}
