package com.idsplit.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
