package com.idsplit.infrastructure.splitting;

import com.idsplit.domain.split.model.SplitResult;
import com.idsplit.domain.split.model.SplitStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Component
public class SplitMetricsTracker {

    private final AtomicLong identifiersSplit = new AtomicLong();
    private final AtomicLong identifiersSubdivided = new AtomicLong();
    private final AtomicLong tokensProduced = new AtomicLong();

    public void record(SplitResult result) {
        long count = identifiersSplit.incrementAndGet();
        tokensProduced.addAndGet(result.tokens().size());
        if (result.wasSplit()) {
            identifiersSubdivided.incrementAndGet();
        }

        log.debug("Split metrics - request #{}: identifierLength={}, tokens={}, cumulative: subdivided={}, avgTokens={}",
                count, result.identifier().length(), result.tokens().size(),
                identifiersSubdivided.get(), String.format("%.2f", getAverageTokensPerIdentifier()));
    }

    public double getAverageTokensPerIdentifier() {
        return average(tokensProduced.get(), identifiersSplit.get());
    }

    /**
     * Each counter is read once and the average is derived from those same reads.
     */
    public SplitStats snapshot() {
        long total = identifiersSplit.get();
        long subdivided = identifiersSubdivided.get();
        long tokens = tokensProduced.get();
        return new SplitStats(total, subdivided, tokens, average(tokens, total));
    }

    private static double average(long tokens, long total) {
        return total > 0 ? (double) tokens / total : 0;
    }
}
