package com.idsplit.domain.split.model;

public record SplitStats(
        long identifiersSplit,
        long identifiersSubdivided,
        long tokensProduced,
        double averageTokensPerIdentifier
) {}
