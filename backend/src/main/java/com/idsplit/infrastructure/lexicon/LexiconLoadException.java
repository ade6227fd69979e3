package com.idsplit.infrastructure.lexicon;

public class LexiconLoadException extends RuntimeException {

    public LexiconLoadException(String message) {
        super(message);
    }

    public LexiconLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
