package com.semsearch.embedding;

import java.util.ArrayList;
import java.util.List;

public interface EmbeddingService {
    EmbeddingModel model();

    float[] embed(String text);

    /**
     * Embeds every text, returning vectors in input order.
     */
    default List<float[]> embedAll(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    default int dimension() {
        return model().dimension();
    }
}
