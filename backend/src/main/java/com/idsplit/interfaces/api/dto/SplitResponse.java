package com.idsplit.interfaces.api.dto;

import com.idsplit.domain.split.model.SplitResult;

import java.util.List;

public record SplitResponse(
        String identifier,
        List<String> tokens
) {
    public static SplitResponse from(SplitResult result) {
        return new SplitResponse(result.identifier(), result.tokens());
    }
}
