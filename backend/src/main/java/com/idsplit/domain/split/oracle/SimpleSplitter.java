package com.idsplit.domain.split.oracle;

import java.util.List;

/**
 * Splits an identifier on its unambiguous boundaries (delimiters, digit runs,
 * lower-to-upper case changes). Segment order follows the identifier.
 */
@FunctionalInterface
public interface SimpleSplitter {

    List<String> split(String identifier);
}
