package com.idsplit.domain.split.service;

import java.util.List;

/**
 * Domain service interface for splitting a program identifier into word tokens.
 */
public interface IdentifierSplitter {

    /**
     * Split an identifier into its constituent tokens.
     *
     * @param identifier the identifier, possibly empty
     * @return the tokens in order; empty for an empty identifier
     */
    List<String> split(String identifier);
}
