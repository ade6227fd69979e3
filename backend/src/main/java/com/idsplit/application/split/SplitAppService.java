package com.idsplit.application.split;

import com.idsplit.application.split.exception.IdentifierTooLongException;
import com.idsplit.domain.split.model.SplitResult;
import com.idsplit.domain.split.model.SplitStats;
import com.idsplit.domain.split.service.IdentifierSplitter;
import com.idsplit.infrastructure.splitting.SplitMetricsTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class SplitAppService {

    private final IdentifierSplitter identifierSplitter;
    private final SplitMetricsTracker metrics;

    @Value("${splitter.max-identifier-length:256}")
    private int maxIdentifierLength;

    @Value("${splitter.max-batch-size:500}")
    private int maxBatchSize;

    /**
     * Split one identifier after checking it against the length limit.
     */
    public SplitResult split(String identifier) {
        validateIdentifier(identifier);

        List<String> tokens = identifier.isEmpty() ? List.of() : identifierSplitter.split(identifier);
        SplitResult result = new SplitResult(identifier, tokens);
        metrics.record(result);

        log.info("Split identifier - length: {}, tokens: {}", identifier.length(), tokens.size());
        return result;
    }

    /**
     * Split a batch of identifiers, preserving order. The whole batch is validated
     * before any identifier is split.
     */
    public List<SplitResult> splitAll(List<String> identifiers) {
        if (identifiers == null) {
            throw new IllegalArgumentException("Identifiers must not be null.");
        }
        if (identifiers.size() > maxBatchSize) {
            throw new IllegalArgumentException(
                    String.format("Batch is too large: %d identifiers (limit %d).", identifiers.size(), maxBatchSize));
        }
        identifiers.forEach(this::validateIdentifier);

        List<SplitResult> results = new ArrayList<>(identifiers.size());
        for (String identifier : identifiers) {
            results.add(split(identifier));
        }
        return results;
    }

    public SplitStats stats() {
        return metrics.snapshot();
    }

    private void validateIdentifier(String identifier) {
        if (identifier == null) {
            throw new IllegalArgumentException("Identifier must not be null.");
        }
        if (identifier.length() > maxIdentifierLength) {
            throw new IdentifierTooLongException(identifier.length(), maxIdentifierLength);
        }
    }
}
