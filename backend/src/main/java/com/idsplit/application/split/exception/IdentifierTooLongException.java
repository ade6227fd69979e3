package com.idsplit.application.split.exception;

public class IdentifierTooLongException extends RuntimeException {
    public IdentifierTooLongException(int length, int maxLength) {
        super(String.format("Identifier is too large: %d characters (limit %d).", length, maxLength));
    }
}
