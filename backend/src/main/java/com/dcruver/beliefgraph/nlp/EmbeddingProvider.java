package com.dcruver.beliefgraph.nlp;

import java.util.List;

/**
 * Text to fixed-width vector.
 */
public interface EmbeddingProvider {

    /**
     * @throws com.dcruver.beliefgraph.exception.ProviderException if no vector could be produced
     */
    float[] embed(String text);

    List<float[]> embedBatch(List<String> texts);

    int getDimensions();

    /**
     * Model identifier recorded with every stored embedding
     */
    String getModelName();
}
