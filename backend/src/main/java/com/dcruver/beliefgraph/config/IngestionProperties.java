package com.dcruver.beliefgraph.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Thresholds, limits and timeouts of the ingestion pipeline.
 */
@ConfigurationProperties(prefix = "beliefgraph.ingestion")
@Data
public class IngestionProperties {

    /**
     * Cosine similarity at or above which a proposition is a duplicate
     */
    private double dedupThreshold = 0.95;

    /**
     * Lower bound of the related band that produces SIMILAR_TO edges
     */
    private double linkThreshold = 0.85;

    private int maxLinksPerNode = 5;

    private int titleWords = 5;

    private Duration extractionTimeout = Duration.ofSeconds(60);

    private Duration embeddingTimeout = Duration.ofSeconds(30);
}
