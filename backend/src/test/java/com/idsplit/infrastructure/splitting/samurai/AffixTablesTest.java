package com.idsplit.infrastructure.splitting.samurai;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AffixTablesTest {

    @Test
    @DisplayName("Prefix lookup is exact and case-insensitive")
    void prefix_lookup() {
        assertThat(AffixTables.isPrefix("un")).isTrue();
        assertThat(AffixTables.isPrefix("UN")).isTrue();
        assertThat(AffixTables.isPrefix("Micro")).isTrue();
        assertThat(AffixTables.isPrefix("und")).isFalse();
        assertThat(AffixTables.isPrefix("u")).isFalse();
    }

    @Test
    @DisplayName("Suffix lookup is exact and case-insensitive")
    void suffix_lookup() {
        assertThat(AffixTables.isSuffix("ing")).isTrue();
        assertThat(AffixTables.isSuffix("TION")).isTrue();
        assertThat(AffixTables.isSuffix("s")).isTrue();
        assertThat(AffixTables.isSuffix("ings")).isFalse();
    }

    @Test
    @DisplayName("Empty and null never match")
    void empty_and_null() {
        assertThat(AffixTables.isPrefix("")).isFalse();
        assertThat(AffixTables.isSuffix("")).isFalse();
        assertThat(AffixTables.isPrefix(null)).isFalse();
        assertThat(AffixTables.isSuffix(null)).isFalse();
    }

    @Test
    @DisplayName("Tables are stored lower-cased")
    void tables_lower_cased() {
        assertThat(AffixTables.prefixes()).hasSizeGreaterThan(80)
                .allMatch(p -> p.equals(p.toLowerCase()));
        assertThat(AffixTables.suffixes()).hasSizeGreaterThan(350)
                .allMatch(s -> s.equals(s.toLowerCase()));
    }
}
