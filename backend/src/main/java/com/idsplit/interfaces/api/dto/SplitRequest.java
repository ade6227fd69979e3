package com.idsplit.interfaces.api.dto;

import jakarta.validation.constraints.NotNull;

public record SplitRequest(
        @NotNull(message = "Identifier is required")
        String identifier
) {}
