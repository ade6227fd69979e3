package com.idsplit.interfaces.api.dto;

import java.util.List;

public record BatchSplitResponse(List<SplitResponse> results) {}
