package com.dcruver.beliefgraph.nlp;

import com.dcruver.beliefgraph.exception.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Generates embeddings using Ollama via Spring AI.
 */
@Service
@Slf4j
public class OllamaEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingModel embeddingModel;
    private final String modelName;
    private final int dimensions;

    public OllamaEmbeddingProvider(
        EmbeddingModel embeddingModel,
        @Value("${spring.ai.ollama.embedding.options.model:nomic-embed-text:latest}") String modelName,
        @Value("${beliefgraph.embedding.dimensions:768}") int dimensions
    ) {
        this.embeddingModel = embeddingModel;
        this.modelName = modelName;
        this.dimensions = dimensions;
        log.info("OllamaEmbeddingProvider initialized with model {} ({} dimensions)", modelName, dimensions);
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new ProviderException("Cannot generate embedding for empty text");
        }
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }

        EmbeddingResponse response;
        try {
            response = embeddingModel.embedForResponse(texts);
        } catch (RuntimeException e) {
            throw new ProviderException("Embedding model call failed: " + e.getMessage(), e);
        }

        if (response == null || response.getResults().size() != texts.size()) {
            throw new ProviderException(String.format("Expected %d embeddings, got %d",
                texts.size(), response == null ? 0 : response.getResults().size()));
        }

        return response.getResults().stream()
            .map(Embedding::getOutput)
            .toList();
    }

    @Override
    public int getDimensions() {
        return dimensions;
    }

    @Override
    public String getModelName() {
        return modelName;
    }
}
