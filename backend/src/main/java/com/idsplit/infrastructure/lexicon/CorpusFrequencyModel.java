package com.idsplit.infrastructure.lexicon;

import com.idsplit.domain.split.oracle.FrequencyModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Word-frequency table mined from a source code corpus.
 *
 * File format: {@code token<whitespace>count} per line. Tokens are case-folded and
 * counts of tokens that fold together are summed. Lines whose count does not parse
 * are skipped.
 */
@Slf4j
public final class CorpusFrequencyModel implements FrequencyModel {

    private static final Pattern FIELD_SEPARATOR = Pattern.compile("\\s+");

    private final Map<String, Double> frequencies;

    private CorpusFrequencyModel(Map<String, Double> frequencies) {
        this.frequencies = Map.copyOf(frequencies);
    }

    public static CorpusFrequencyModel load(Resource resource) {
        Map<String, Double> out = new HashMap<>();
        LexiconReader.forEachEntry(resource, (line, lineNumber) -> {
            String[] fields = FIELD_SEPARATOR.split(line);
            if (fields.length != 2) {
                log.warn("Skipping malformed frequency entry at line {}: {}", lineNumber, line);
                return;
            }
            double count;
            try {
                count = Double.parseDouble(fields[1]);
            } catch (NumberFormatException e) {
                log.warn("Skipping frequency entry with invalid count at line {}: {}", lineNumber, line);
                return;
            }
            if (count < 0 || Double.isNaN(count) || Double.isInfinite(count)) {
                log.warn("Skipping frequency entry with out-of-range count at line {}: {}", lineNumber, line);
                return;
            }
            out.merge(fields[0].toLowerCase(Locale.ROOT), count, Double::sum);
        });
        log.info("Loaded {} word frequencies from {}", out.size(), resource.getDescription());
        return new CorpusFrequencyModel(out);
    }

    @Override
    public double frequency(String token) {
        if (token == null || token.isEmpty()) {
            return 0;
        }
        return frequencies.getOrDefault(token.toLowerCase(Locale.ROOT), 0.0);
    }

    public int size() {
        return frequencies.size();
    }
}
