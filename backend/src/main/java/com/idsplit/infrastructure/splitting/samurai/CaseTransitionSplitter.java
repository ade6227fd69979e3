package com.idsplit.infrastructure.splitting.samurai;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves the first upper-to-lower case transition in a segment: either the
 * capital starts the following word ({@code GPS|Module}) or it ends the preceding
 * one ({@code GPSM|odule}). Only the first transition is examined.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CaseTransitionSplitter {

    private static final Pattern UPPER_TO_LOWER = Pattern.compile("[A-Z][a-z]");

    private final ScoringModel scoring;

    public List<String> split(String segment) {
        Matcher transition = UPPER_TO_LOWER.matcher(segment);
        if (!transition.find()) {
            log.debug("no upper-to-lower case transition in {}", segment);
            return List.of(segment);
        }

        int i = transition.start();
        log.debug("case transition: {}{}", segment.charAt(i), segment.charAt(i + 1));

        String camel = i > 0 ? segment.substring(i) : segment;
        double camelScore = scoring.score(camel);
        log.debug("\"{}\" score {}", camel, camelScore);

        String alt = segment.substring(i + 1);
        double altScore = scoring.rescale(alt, scoring.score(alt));
        log.debug("\"{}\" rescaled alt score {}", alt, altScore);

        List<String> parts;
        if (camelScore > altScore) {
            log.debug("{} > {} ==> better to include uppercase letter", camelScore, altScore);
            parts = i > 0
                    ? List.of(segment.substring(0, i), segment.substring(i))
                    : List.of(segment);
        } else {
            log.debug("not better to include uppercase letter");
            parts = List.of(segment.substring(0, i + 1), segment.substring(i + 1));
        }
        log.debug("split outcome: {}", parts);
        return parts;
    }
}
