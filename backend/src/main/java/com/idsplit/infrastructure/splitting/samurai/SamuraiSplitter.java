package com.idsplit.infrastructure.splitting.samurai;

import com.idsplit.domain.split.oracle.SimpleSplitter;
import com.idsplit.domain.split.service.IdentifierSplitter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Frequency-driven identifier splitter (the Samurai algorithm):
 * <p>
 * delimiter split → case-transition split per segment → same-case split per piece
 * </p>
 * Each same-case split uses the piece's own score as its threshold floor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SamuraiSplitter implements IdentifierSplitter {

    private final SimpleSplitter simpleSplitter;
    private final CaseTransitionSplitter caseTransitionSplitter;
    private final SameCaseSplitter sameCaseSplitter;
    private final ScoringModel scoring;

    @Override
    public List<String> split(String identifier) {
        log.debug("splitting {}", identifier);

        List<String> pieces = new ArrayList<>();
        for (String segment : simpleSplitter.split(identifier)) {
            pieces.addAll(caseTransitionSplitter.split(segment));
        }
        log.debug("turning over to same-case split: {}", pieces);

        List<String> results = new ArrayList<>();
        for (String piece : pieces) {
            results.addAll(sameCaseSplitter.split(piece, scoring.score(piece)));
        }
        log.debug("final results: {}", results);
        return results;
    }
}
