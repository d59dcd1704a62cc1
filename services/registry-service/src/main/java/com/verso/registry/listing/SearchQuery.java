package com.verso.registry.listing;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Case-insensitive substring search over display text. Terms come from splitting the query on
 * whitespace; with {@code matchAny} one term must occur, otherwise every term must occur.
 * A query without terms matches everything.
 */
public final class SearchQuery {
    private final List<String> terms;
    private final boolean matchAny;

    private SearchQuery(List<String> terms, boolean matchAny) {
        this.terms = terms;
        this.matchAny = matchAny;
    }

    public static SearchQuery compile(String query, boolean matchAny) {
        if (query == null || query.isBlank()) {
            return new SearchQuery(List.of(), matchAny);
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String token : query.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                unique.add(token.toLowerCase(Locale.ROOT));
            }
        }
        return new SearchQuery(List.copyOf(unique), matchAny);
    }

    public boolean matches(String candidate) {
        if (terms.isEmpty()) {
            return true;
        }
        String text = candidate == null ? "" : candidate.toLowerCase(Locale.ROOT);
        if (matchAny) {
            for (String term : terms) {
                if (text.contains(term)) {
                    return true;
                }
            }
            return false;
        }
        for (String term : terms) {
            if (!text.contains(term)) {
                return false;
            }
        }
        return true;
    }

    public List<String> getTerms() {
        return terms;
    }

    public boolean isMatchAny() {
        return matchAny;
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }
}
