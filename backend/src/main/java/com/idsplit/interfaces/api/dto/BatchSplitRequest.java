package com.idsplit.interfaces.api.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Batch size is bounded by {@code splitter.max-batch-size} in the application layer.
 */
public record BatchSplitRequest(
        @NotEmpty(message = "At least one identifier is required")
        List<@NotNull(message = "Identifiers must not be null") String> identifiers
) {}
