package com.dcruver.beliefgraph.config;

import io.micrometer.observation.ObservationRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.OllamaEmbeddingModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.ai.ollama.management.ModelManagementOptions;
import org.springframework.ai.ollama.management.PullModelStrategy;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Configuration for Spring AI ChatModel and EmbeddingModel beans.
 *
 * The chat model is used for proposition extraction and asks Ollama for JSON output;
 * the embedding model backs dedup and linking.
 */
@Configuration
@Slf4j
public class SpringAIConfiguration {

    @Value("${spring.ai.ollama.base-url:http://localhost:11434}")
    private String ollamaBaseUrl;

    @Value("${spring.ai.ollama.chat.options.model:llama3.2}")
    private String chatModelName;

    @Value("${spring.ai.ollama.embedding.options.model:nomic-embed-text:latest}")
    private String embeddingModelName;

    @Value("${spring.ai.ollama.chat.options.temperature:0.1}")
    private Double temperature;

    @Bean
    public OllamaApi ollamaApi() {
        log.info("Creating OllamaApi with base URL: {}", ollamaBaseUrl);
        return OllamaApi.builder()
                .baseUrl(ollamaBaseUrl)
                .build();
    }

    /**
     * Chat model for extraction. Output is constrained to JSON.
     */
    @Bean
    @Primary
    public ChatModel chatModel(OllamaApi ollamaApi, ObjectProvider<ObservationRegistry> observationRegistry) {
        log.info("Creating ChatModel with Ollama model: {}", chatModelName);

        var options = OllamaOptions.builder()
                .model(chatModelName)
                .temperature(temperature)
                .format("json")
                .build();

        return OllamaChatModel.builder()
                .ollamaApi(ollamaApi)
                .defaultOptions(options)
                .observationRegistry(observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP))
                .modelManagementOptions(noPull())
                .build();
    }

    @Bean
    @Primary
    public EmbeddingModel embeddingModel(OllamaApi ollamaApi, ObjectProvider<ObservationRegistry> observationRegistry) {
        log.info("Creating EmbeddingModel with Ollama model: {}", embeddingModelName);

        var options = OllamaOptions.builder()
                .model(embeddingModelName)
                .build();

        return OllamaEmbeddingModel.builder()
                .ollamaApi(ollamaApi)
                .defaultOptions(options)
                .observationRegistry(observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP))
                .modelManagementOptions(noPull())
                .build();
    }

    // Models must already exist in Ollama
    private static ModelManagementOptions noPull() {
        return ModelManagementOptions.builder()
                .pullModelStrategy(PullModelStrategy.NEVER)
                .build();
    }
}
