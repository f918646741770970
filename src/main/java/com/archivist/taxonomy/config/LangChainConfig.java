package com.archivist.taxonomy.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiEmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class LangChainConfig {

    @Value("${app.gemini.api-key}")
    private String apiKey;

    @Value("${app.gemini.chat-model:gemini-2.5-flash}")
    private String chatModelName;

    @Value("${app.gemini.embedding-model:text-embedding-004}")
    private String embeddingModelName;

    @Value("${app.gemini.embedding-dimensions:768}")
    private int embeddingDimensions;

    @Bean
    public ChatModel chatModel() {
        return GoogleAiGeminiChatModel.builder()
            .apiKey(apiKey)
            .modelName(chatModelName)
            .temperature(0.3)
            .timeout(Duration.ofSeconds(60))
            .maxRetries(3)
            .build();
    }

    @Bean
    public EmbeddingModel embeddingModel() {
        return GoogleAiEmbeddingModel.builder()
            .apiKey(apiKey)
            .modelName(embeddingModelName)
            .outputDimensionality(embeddingDimensions)
            .timeout(Duration.ofSeconds(60))
            .maxRetries(0)
            .build();
    }
}
