package com.idsplit.interfaces.api.dto;

import com.idsplit.domain.split.model.SplitStats;

public record SplitStatsResponse(
        long identifiersSplit,
        long identifiersSubdivided,
        long tokensProduced,
        double averageTokensPerIdentifier
) {
    public static SplitStatsResponse from(SplitStats stats) {
        return new SplitStatsResponse(
                stats.identifiersSplit(),
                stats.identifiersSubdivided(),
                stats.tokensProduced(),
                stats.averageTokensPerIdentifier());
    }
}
