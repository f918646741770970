package com.archivist.taxonomy.batch;

import com.archivist.taxonomy.config.AnthropicProperties;
import com.archivist.taxonomy.exception.BatchServiceException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Consumer;

@Slf4j
@Service
public class AnthropicBatchService implements BatchService {

    private static final String BATCHES_PATH = "/v1/messages/batches";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final AnthropicProperties properties;

    public AnthropicBatchService(@Qualifier("anthropicRestClient") RestClient restClient,
                                 ObjectMapper objectMapper,
                                 AnthropicProperties properties) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Params(
        String model,
        @JsonProperty("max_tokens") int maxTokens,
        double temperature,
        String system,
        List<Message> messages
    ) {}

    record Message(String role, String content) {}

    record Request(@JsonProperty("custom_id") String customId, Params params) {}

    record CreateBatchRequest(List<Request> requests) {}

    @Override
    public String submitBatch(List<BatchItem> items) {
        validate(items);

        List<Request> requests = items.stream()
            .map(item -> new Request(item.customId(), new Params(
                properties.model(),
                item.maxTokens(),
                properties.temperature(),
                item.systemPrompt(),
                List.of(new Message("user", item.prompt()))
            )))
            .toList();

        JsonNode response;
        try {
            response = restClient.post()
                .uri(BATCHES_PATH)
                .body(new CreateBatchRequest(requests))
                .retrieve()
                .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new BatchServiceException("Batch submission failed: " + e.getMessage(), null, e);
        }

        String handle = response == null ? null : response.path("id").asText(null);
        if (handle == null || handle.isBlank()) {
            throw new BatchServiceException("Batch submission returned no batch id", null);
        }

        log.info("Submitted batch {} with {} requests", handle, items.size());
        return handle;
    }

    @Override
    public BatchStatus getBatchStatus(String handle) {
        JsonNode response;
        try {
            response = restClient.get()
                .uri(BATCHES_PATH + "/{id}", handle)
                .retrieve()
                .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new BatchServiceException("Status check failed: " + e.getMessage(), handle, e);
        }

        if (response == null || !response.hasNonNull("processing_status")) {
            throw new BatchServiceException("Malformed batch status response", handle);
        }

        JsonNode counts = response.path("request_counts");
        RequestCounts requestCounts = new RequestCounts(
            counts.path("processing").asInt(),
            counts.path("succeeded").asInt(),
            counts.path("errored").asInt(),
            counts.path("canceled").asInt(),
            counts.path("expired").asInt()
        );

        return new BatchStatus(handle, toState(response.get("processing_status").asText()), requestCounts);
    }

    @Override
    public void streamBatchResults(String handle, Consumer<BatchItemResult> consumer) {
        try {
            restClient.get()
                .uri(BATCHES_PATH + "/{id}/results", handle)
                .exchange((request, response) -> {
                    if (response.getStatusCode().isError()) {
                        throw new BatchServiceException(
                            "Results download failed with HTTP " + response.getStatusCode().value(), handle);
                    }
                    try (BufferedReader reader = new BufferedReader(
                        new InputStreamReader(response.getBody(), StandardCharsets.UTF_8))) {
                        String line;
                        int lineNumber = 0;
                        while ((line = reader.readLine()) != null) {
                            lineNumber++;
                            if (line.isBlank()) {
                                continue;
                            }
                            BatchItemResult result = parseResultLine(handle, lineNumber, line);
                            if (result != null) {
                                consumer.accept(result);
                            }
                        }
                    }
                    return null;
                });
        } catch (RestClientException e) {
            throw new BatchServiceException("Results download failed: " + e.getMessage(), handle, e);
        }
    }

    private BatchItemResult parseResultLine(String handle, int lineNumber, String line) {
        JsonNode node;
        try {
            node = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.warn("Skipping unreadable result line {} of batch {}: {}", lineNumber, handle, e.getOriginalMessage());
            return null;
        }

        String customId = node.path("custom_id").asText(null);
        if (customId == null) {
            log.warn("Skipping result line {} of batch {} without custom_id", lineNumber, handle);
            return null;
        }

        JsonNode result = node.path("result");
        String type = result.path("type").asText("");
        switch (type) {
            case "succeeded" -> {
                StringBuilder text = new StringBuilder();
                for (JsonNode block : result.path("message").path("content")) {
                    if ("text".equals(block.path("type").asText())) {
                        text.append(block.path("text").asText());
                    }
                }
                return BatchItemResult.succeeded(customId, text.toString());
            }
            case "errored" -> {
                return BatchItemResult.failed(customId, BatchItemResult.Outcome.ERRORED, errorMessage(result.path("error")));
            }
            case "canceled" -> {
                return BatchItemResult.failed(customId, BatchItemResult.Outcome.CANCELED, "Request canceled");
            }
            case "expired" -> {
                return BatchItemResult.failed(customId, BatchItemResult.Outcome.EXPIRED, "Request expired");
            }
            default -> {
                return BatchItemResult.failed(customId, BatchItemResult.Outcome.ERRORED, "Unknown result type '" + type + "'");
            }
        }
    }

    private static String errorMessage(JsonNode error) {
        JsonNode nested = error.path("error");
        JsonNode source = nested.isObject() ? nested : error;
        String type = source.path("type").asText("error");
        String message = source.path("message").asText("no message");
        return type + ": " + message;
    }

    private static BatchState toState(String processingStatus) {
        return switch (processingStatus.toLowerCase(Locale.ROOT)) {
            case "ended" -> BatchState.ENDED;
            case "in_progress", "canceling" -> BatchState.IN_PROGRESS;
            default -> BatchState.ERRORED;
        };
    }

    private static void validate(List<BatchItem> items) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("Cannot submit an empty batch");
        }
        if (items.size() > MAX_ITEMS_PER_BATCH) {
            throw new IllegalArgumentException("Batch of " + items.size() + " exceeds the limit of " + MAX_ITEMS_PER_BATCH);
        }
        Set<String> seen = new HashSet<>();
        for (BatchItem item : items) {
            String customId = item.customId();
            if (customId == null || customId.indexOf(':') <= 0) {
                throw new IllegalArgumentException("Custom id must have the form entityType:entityId: " + customId);
            }
            if (customId.length() > CustomId.MAX_LENGTH) {
                throw new IllegalArgumentException("Custom id exceeds " + CustomId.MAX_LENGTH + " characters: " + customId);
            }
            if (!seen.add(customId)) {
                throw new IllegalArgumentException("Duplicate custom id: " + customId);
            }
        }
    }
}
