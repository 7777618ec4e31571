package com.dcruver.beliefgraph.nlp;

import com.dcruver.beliefgraph.domain.Proposition;

import java.util.List;

/**
 * Turns free text into atomic propositions.
 */
public interface ExtractionProvider {

    /**
     * Extract propositions from one message.
     *
     * @throws com.dcruver.beliefgraph.exception.ProviderException if the model cannot be reached
     * @throws com.dcruver.beliefgraph.exception.ExtractionException if the response does not match the schema
     */
    List<Proposition> extract(String text);
}
