package com.idsplit.infrastructure.splitting.samurai;

import com.idsplit.domain.split.oracle.DictionaryOracle;
import com.idsplit.domain.split.oracle.FrequencyModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Frequency evidence for candidate tokens.
 * <ul>
 *   <li>{@link #score(String)} is the corpus frequency, floored to 0 below the noise threshold.</li>
 *   <li>{@link #rescale(String, double)} normalizes a score before it is compared with a split threshold.
 *       Short dictionary words get a square root, everything else a 2.5th root.</li>
 * </ul>
 */
@Component
public class ScoringModel {

    public static final double DEFAULT_NOISE_THRESHOLD = 30;

    private final FrequencyModel frequencyModel;
    private final DictionaryOracle dictionary;
    private final double noiseThreshold;

    public ScoringModel(FrequencyModel frequencyModel,
                        DictionaryOracle dictionary,
                        @Value("${splitter.scoring.noise-threshold:30}") double noiseThreshold) {
        this.frequencyModel = frequencyModel;
        this.dictionary = dictionary;
        this.noiseThreshold = noiseThreshold;
    }

    public double score(String token) {
        if (token == null || token.isEmpty()) {
            return 0;
        }
        double frequency = frequencyModel.frequency(token);
        return frequency < noiseThreshold ? 0 : frequency;
    }

    public double rescale(String token, double score) {
        if (token.length() <= 1) {
            return 0;
        } else if (token.length() <= 4 && isWord(token)) {
            return Math.sqrt(score);
        } else {
            return Math.pow(score, 1.0 / 2.5);
        }
    }

    public boolean isWord(String token) {
        return dictionary.isWord(token);
    }
}
