package com.verso.registry.listing;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SearchQueryTest {

    @Test
    void allModeRequiresEveryTerm() {
        assertThat(SearchQuery.compile("foo bar", false).matches("foo bar baz")).isTrue();
        assertThat(SearchQuery.compile("foo qux", false).matches("foo bar")).isFalse();
    }

    @Test
    void anyModeRequiresOneTerm() {
        assertThat(SearchQuery.compile("foo qux", true).matches("foo bar")).isTrue();
        assertThat(SearchQuery.compile("qux zap", true).matches("foo bar")).isFalse();
    }

    @Test
    void emptyQueryMatchesEverything() {
        assertThat(SearchQuery.compile("", false).matches("anything")).isTrue();
        assertThat(SearchQuery.compile("   ", true).matches("anything")).isTrue();
        assertThat(SearchQuery.compile(null, true).isEmpty()).isTrue();
    }

    @Test
    void termsAreLowerCasedAndDeduplicated() {
        SearchQuery query = SearchQuery.compile("  Dragon\tdragon  KING ", false);

        assertThat(query.getTerms()).containsExactly("dragon", "king");
        assertThat(query.matches("The DRAGON King (BOOK)")).isTrue();
    }
}
