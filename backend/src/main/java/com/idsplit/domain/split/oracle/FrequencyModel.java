package com.idsplit.domain.split.oracle;

/**
 * Read-only corpus frequency lookup.
 * Lookups are case-insensitive and return 0 for unknown tokens instead of failing.
 */
@FunctionalInterface
public interface FrequencyModel {

    double frequency(String token);
}
