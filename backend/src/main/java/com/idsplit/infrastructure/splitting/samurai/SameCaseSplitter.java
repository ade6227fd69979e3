package com.idsplit.infrastructure.splitting.samurai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a token that carries no case boundary of its own (all lower-case, all
 * upper-case, or a piece already cut at a case transition).
 *
 * Every cut position is scanned. At each position:
 * <ul>
 *   <li>Case 1: both halves clear the threshold. The cut with the highest combined
 *       score among case-1 cuts is kept.</li>
 *   <li>Case 2: only the left half clears it. The right half is split recursively and,
 *       if that produced a split, the left half plus the recursive split replaces
 *       whatever was recorded before.</li>
 * </ul>
 * Cuts that would leave a known prefix on the left or a known suffix on the right
 * are skipped. Single characters and dictionary words are returned as-is.
 */
@Slf4j
@Component
public class SameCaseSplitter {

    public static final double DEFAULT_SCORE_FLOOR = 0.0000005;

    private final ScoringModel scoring;
    private final double defaultScoreFloor;

    public SameCaseSplitter(ScoringModel scoring,
                            @Value("${splitter.scoring.default-floor:5.0E-7}") double defaultScoreFloor) {
        this.scoring = scoring;
        this.defaultScoreFloor = defaultScoreFloor;
    }

    public List<String> split(String token) {
        return split(token, defaultScoreFloor);
    }

    /**
     * @param token      the token to split
     * @param scoreFloor lower bound for the split threshold
     * @return the pieces, in order; a single element holding {@code token} if no cut qualifies
     */
    public List<String> split(String token, double scoreFloor) {
        return split(token, scoreFloor, new HashMap<>());
    }

    /**
     * Remainders are re-split many times by case 2; {@code memo} holds each remainder's
     * split for the current top-level call, where the floor is fixed.
     */
    private List<String> split(String token, double scoreFloor, Map<String, List<String>> memo) {
        List<String> cached = memo.get(token);
        if (cached != null) {
            return cached;
        }
        List<String> result = computeSplit(token, scoreFloor, memo);
        memo.put(token, result);
        return result;
    }

    private List<String> computeSplit(String token, double scoreFloor, Map<String, List<String>> memo) {
        if (token.length() < 2) {
            log.debug("\"{}\" cannot be split; returning as-is", token);
            return List.of(token);
        }
        if (scoring.isWord(token)) {
            log.debug("\"{}\" is a dictionary word; returning as-is", token);
            return List.of(token);
        }

        List<String> split = null;
        double maxScore = -1;
        double threshold = Math.max(scoring.score(token), scoreFloor);
        log.debug("\"{}\" threshold score = {}", token, threshold);

        int n = token.length();
        for (int i = 0; i < n; i++) {
            String left = token.substring(0, i);
            String right = token.substring(i);
            double scoreL = scoring.score(left);
            double scoreR = scoring.score(right);
            double rescaledL = scoring.rescale(left, scoreL);
            double rescaledR = scoring.rescale(right, scoreR);
            boolean affix = AffixTables.isPrefix(left) || AffixTables.isSuffix(right);
            boolean toSplitL = rescaledL > threshold;
            boolean toSplitR = rescaledR > threshold;

            log.debug("|{} : {}| l = {} r = {} splitL = {} splitR = {} affix = {} maxScore = {}",
                    left, right, rescaledL, rescaledR, toSplitL, toSplitR, affix, maxScore);

            if (affix || !toSplitL) {
                continue;
            }
            if (toSplitR) {
                if (scoreL + scoreR > maxScore) {
                    maxScore = scoreL + scoreR;
                    split = List.of(left, right);
                    log.debug("case 1 split result: {}", split);
                }
            } else {
                List<String> rest = split(right, scoreFloor, memo);
                if (!rest.get(0).equals(right)) {
                    List<String> combined = new ArrayList<>(rest.size() + 1);
                    combined.add(left);
                    combined.addAll(rest);
                    split = List.copyOf(combined);
                    log.debug("case 2 split result: {}", split);
                }
            }
        }

        List<String> result = split != null ? split : List.of(token);
        log.debug("<-- returning {}", result);
        return result;
    }
}
