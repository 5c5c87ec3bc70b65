package com.semsearch.embedding;

import java.util.Locale;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic in-process encoder. Tokens, character trigrams and token bigrams are hashed
 * into the model's dimension with weights taken from the model variant, then L2-normalised.
 */
public class LocalModelEmbeddingService implements EmbeddingService {
    private static final Logger log = LoggerFactory.getLogger(LocalModelEmbeddingService.class);
    private static final Pattern NON_WORD = Pattern.compile("\\W+", Pattern.UNICODE_CHARACTER_CLASS);

    private final EmbeddingModel model;
    private final String salt;

    public LocalModelEmbeddingService(EmbeddingModel model) {
        this.model = model;
        this.salt = model.shortName() + ":";
        log.info("Loaded local embedding model {} ({} dimensions)", model.id(), model.dimension());
    }

    @Override
    public EmbeddingModel model() {
        return model;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[model.dimension()];
        if (text == null || text.isBlank()) {
            return vector;
        }

        String[] tokens = NON_WORD.split(text.toLowerCase(Locale.ROOT));
        String previous = null;
        for (String token : tokens) {
            if (token.isBlank()) {
                continue;
            }
            addHashed(vector, "tok:" + token, 1.0f);
            if (model.trigramWeight() > 0f && token.length() >= 3) {
                for (int i = 0; i <= token.length() - 3; i++) {
                    addHashed(vector, "tri:" + token.substring(i, i + 3), model.trigramWeight());
                }
            }
            if (model.bigramWeight() > 0f && previous != null) {
                addHashed(vector, "bi:" + previous + ' ' + token, model.bigramWeight());
            }
            previous = token;
        }

        Vectors.normalizeInPlace(vector);
        return vector;
    }

    private void addHashed(float[] vector, String key, float weight) {
        int index = Math.floorMod((salt + key).hashCode(), vector.length);
        vector[index] += weight;
    }
}
