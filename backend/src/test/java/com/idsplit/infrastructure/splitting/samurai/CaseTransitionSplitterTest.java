package com.idsplit.infrastructure.splitting.samurai;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CaseTransitionSplitterTest {

    private static CaseTransitionSplitter splitter(FakeLexicon lexicon) {
        return new CaseTransitionSplitter(lexicon.scoring());
    }

    @Test
    @DisplayName("No upper-to-lower transition → segment unchanged")
    void no_transition() {
        CaseTransitionSplitter splitter = splitter(new FakeLexicon().freq("module", 900));
        assertThat(splitter.split("GPS")).containsExactly("GPS");
        assertThat(splitter.split("getdata")).containsExactly("getdata");
        assertThat(splitter.split("x")).containsExactly("x");
    }

    @Test
    @DisplayName("Capital starts the next word when the camel piece scores higher")
    void camel_piece_wins() {
        CaseTransitionSplitter splitter = splitter(new FakeLexicon().freq("parser", 500));
        assertThat(splitter.split("XMLParser")).containsExactly("XML", "Parser");
    }

    @Test
    @DisplayName("Capital ends the previous piece when the remainder scores higher")
    void remainder_wins() {
        CaseTransitionSplitter splitter = splitter(new FakeLexicon().freq("module", 900));
        assertThat(splitter.split("GPSmodule")).containsExactly("GPS", "module");
    }

    @Test
    @DisplayName("Transition at index 0: keep whole segment when it scores higher")
    void leading_capital_kept() {
        CaseTransitionSplitter splitter = splitter(new FakeLexicon().freq("foobar", 500));
        assertThat(splitter.split("Foobar")).containsExactly("Foobar");
    }

    @Test
    @DisplayName("Transition at index 0: split off the capital when the remainder scores higher")
    void leading_capital_split_off() {
        CaseTransitionSplitter splitter = splitter(new FakeLexicon().freq("tree", 500));
        assertThat(splitter.split("Xtree")).containsExactly("X", "tree");
    }

    @Test
    @DisplayName("Exact tie goes to the remainder branch")
    void tie_breaks_to_remainder() {
        // score("Foo") = 100, rescale("oo", 10000) = sqrt(10000) = 100
        CaseTransitionSplitter tied = splitter(new FakeLexicon()
                .freq("foo", 100)
                .freq("oo", 10000)
                .word("oo"));
        assertThat(tied.split("xyFoo")).containsExactly("xyF", "oo");

        CaseTransitionSplitter ahead = splitter(new FakeLexicon()
                .freq("foo", 101)
                .freq("oo", 10000)
                .word("oo"));
        assertThat(ahead.split("xyFoo")).containsExactly("xy", "Foo");
    }

    @Test
    @DisplayName("Only the first transition is examined")
    void first_transition_only() {
        CaseTransitionSplitter splitter = splitter(new FakeLexicon().freq("foobar", 500));
        assertThat(splitter.split("ABCFooBar")).containsExactly("ABC", "FooBar");
    }
}
