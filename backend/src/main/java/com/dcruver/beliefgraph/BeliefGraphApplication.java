package com.dcruver.beliefgraph;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the belief graph.
 *
 * Ingests conversation text into a personal knowledge graph: propositions are
 * extracted by a local model, deduplicated by embedding similarity and stored as
 * typed nodes and edges in SQLite. Driven from the Spring Shell.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class BeliefGraphApplication {

    public static void main(String[] args) {
        log.info("Starting Belief Graph...");
        SpringApplication.run(BeliefGraphApplication.class, args);
    }
}
