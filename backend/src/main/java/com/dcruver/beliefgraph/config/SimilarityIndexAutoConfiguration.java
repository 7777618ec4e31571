package com.dcruver.beliefgraph.config;

import com.dcruver.beliefgraph.index.InMemorySimilarityIndex;
import com.dcruver.beliefgraph.index.SimilarityIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * Default in-memory similarity index. Declaring another {@link SimilarityIndex} bean replaces it.
 * Loaded as auto-configuration, after the application's own beans.
 */
@AutoConfiguration
@Slf4j
public class SimilarityIndexAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(SimilarityIndex.class)
    public SimilarityIndex similarityIndex(
            @Value("${beliefgraph.index.soft-ceiling:50000}") int softCeiling) {
        log.info("Using in-memory similarity index (soft ceiling {} vectors per type)", softCeiling);
        return new InMemorySimilarityIndex(softCeiling);
    }
}
