package com.verso.registry.listing;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Dispatches a listing request to exactly one index read. The filter is chosen by precedence, the
 * mode by {@link ListingMode#select}. Search and "all" modes ignore pagination.
 */
@Service
public class ListingEngine {
    private static final Logger logger = LoggerFactory.getLogger(ListingEngine.class);

    public <V> List<V> list(ListingDefinition<V> definition, Map<String, String> query) {
        ListingParams params = ListingParams.parse(query, definition.getDefaultLimit());
        ListingDefinition.Selection<V> selection = definition.select(query);
        ListingMode mode = ListingMode.select(params, definition.isAllWhenLimitAbsent());
        logger.debug(
            "listing={} filter={} key={} mode={} sorted={}",
            definition.getName(),
            selection.filter(),
            selection.key(),
            mode,
            params.sorted()
        );

        return switch (mode) {
            case SEARCH -> {
                SearchQuery searchQuery = params.searchQuery();
                List<V> matched = new ArrayList<>();
                for (V value : selection.source().all(selection.key())) {
                    if (searchQuery.matches(definition.displayText(value))) {
                        matched.add(value);
                    }
                }
                yield params.sorted() ? sortByDisplayText(definition, matched) : matched;
            }
            case ALL -> {
                List<V> values = selection.source().all(selection.key());
                yield params.sorted() ? sortByDisplayText(definition, values) : values;
            }
            case PAGE -> selection.source().page(selection.key(), params.page());
        };
    }

    private <V> List<V> sortByDisplayText(ListingDefinition<V> definition, List<V> values) {
        List<V> sorted = new ArrayList<>(values);
        sorted.sort(Comparator.comparing(definition::displayText));
        return sorted;
    }
}
