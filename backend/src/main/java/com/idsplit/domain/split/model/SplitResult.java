package com.idsplit.domain.split.model;

import java.util.List;

/**
 * Value object holding the tokens an identifier was split into.
 *
 * @param identifier the identifier as submitted
 * @param tokens     the tokens in their original order
 */
public record SplitResult(
        String identifier,
        List<String> tokens
) {
    public SplitResult {
        tokens = List.copyOf(tokens);
    }

    public boolean wasSplit() {
        return tokens.size() > 1;
    }
}
