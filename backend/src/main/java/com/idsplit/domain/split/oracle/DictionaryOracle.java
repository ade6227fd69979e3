package com.idsplit.domain.split.oracle;

/**
 * Case-insensitive natural-language dictionary membership test.
 */
@FunctionalInterface
public interface DictionaryOracle {

    boolean isWord(String token);
}
