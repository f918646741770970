package com.archivist.taxonomy.service;

import com.archivist.taxonomy.exception.EmbeddingException;
import com.archivist.taxonomy.infra.RateLimiter;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
public class EmbeddingClient {

    public static final String EMBEDDING_LIMIT = "embedding_limit";

    private final EmbeddingModel embeddingModel;
    private final RateLimiter embeddingLimiter;

    public EmbeddingClient(EmbeddingModel embeddingModel, @Qualifier("embeddingLimiter") RateLimiter embeddingLimiter) {
        this.embeddingModel = embeddingModel;
        this.embeddingLimiter = embeddingLimiter;
    }

    @Retryable(
        retryFor = {RetriableException.class, EmbeddingException.class},
        maxAttemptsExpression = "${app.pipeline.embedding.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${app.pipeline.embedding.retry-delay-ms:2000}", multiplier = 2.0)
    )
    public List<float[]> embedAll(List<String> texts) {
        List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();

        Response<List<Embedding>> response = embeddingLimiter.execute(EMBEDDING_LIMIT, texts.size(),
            () -> embeddingModel.embedAll(segments));

        List<Embedding> embeddings = response == null ? null : response.content();
        if (embeddings == null || embeddings.size() != texts.size()) {
            throw new EmbeddingException("Embedding model returned " + (embeddings == null ? 0 : embeddings.size())
                + " vectors for " + texts.size() + " texts");
        }

        return embeddings.stream()
            .map(embedding -> {
                float[] vector = embedding.vector();
                if (vector == null || vector.length == 0) {
                    throw new EmbeddingException("Embedding model returned an empty vector");
                }
                return vector;
            })
            .toList();
    }
}
