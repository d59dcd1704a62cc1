package com.verso.registry.service;

import com.verso.registry.config.RegistryProperties;
import com.verso.registry.domain.metric.Metric;
import com.verso.registry.domain.metric.MetricStat;
import com.verso.registry.listing.DateRange;
import com.verso.registry.listing.FanOutRetriever;
import com.verso.registry.listing.FilterValues;
import com.verso.registry.listing.ListingDefinition;
import com.verso.registry.listing.ListingEngine;
import com.verso.registry.listing.ListingParams;
import com.verso.registry.repository.EntityStore;
import com.verso.registry.repository.EntityTables;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Service;

@Service
public class MetricService extends EntityService<Metric> {
    private static final List<Filter> FILTERS = List.of(
        new Filter(EntityTables.ENTITY, FilterValues.entityId()),
        new Filter("type", EntityTables.ENTITY_TYPE, FilterValues.text()),
        new Filter(EntityTables.TAG, FilterValues.lowerCase())
    );

    private final ListingDefinition<Metric> statsListing;

    public MetricService(
        EntityStore<Metric> metricStore,
        ListingEngine listingEngine,
        FanOutRetriever retriever,
        RegistryProperties properties
    ) {
        super(metricStore, listingEngine, retriever, properties, properties.getListing().getEntityLimit(), FILTERS);
        ListingDefinition.Builder<Metric> stats = ListingDefinition.builder("metric_stats", Metric::getTitle);
        for (Filter filter : FILTERS) {
            stats.filter(filter.parameter(), filter.normalizer(), IndexSources.entities(metricStore, filter.index()));
        }
        this.statsListing = stats.build();
    }

    /**
     * Metrics under the first supplied filter. With both {@code from} and {@code to}, every metric
     * created in that window is returned and pagination is ignored.
     */
    @Override
    public List<Metric> list(Map<String, String> query) {
        Optional<DateRange> range = DateRange.parse(query);
        if (range.isEmpty()) {
            return super.list(query);
        }
        ListingDefinition.Selection<Metric> selection = entityListing().select(query);
        if (selection.filter() == null) {
            return super.list(query);
        }
        ListingParams params = ListingParams.parse(query, getProperties().getListing().getEntityLimit());
        List<Metric> metrics = within(selection.source().all(selection.key()), range);
        if (params.reverse()) {
            Collections.reverse(metrics);
        }
        return metrics;
    }

    /**
     * Aggregates every metric under the first supplied filter, in the same precedence as listings,
     * optionally limited to a creation-date window.
     */
    public MetricStat stats(Map<String, String> query) {
        Optional<DateRange> range = DateRange.parse(query);
        ListingDefinition.Selection<Metric> selection = statsListing.select(query);
        List<Metric> metrics = within(selection.source().all(selection.key()), range);
        return MetricStat.of(selection.filter(), selection.key(), metrics);
    }

    @Override
    protected void prepare(Metric metric, Optional<Metric> previous, Instant now) {
        if (metric.getExpiresAt() == null) {
            metric.setExpiresAt(now.plus(Duration.ofDays(getProperties().getRetention().getMetricDays())));
        }
        if (metric.getTags() == null) {
            metric.setTags(new ArrayList<>());
            return;
        }
        metric.setTags(metric.getTags().stream()
            .filter(tag -> tag != null && !tag.isBlank())
            .map(tag -> tag.trim().toLowerCase(Locale.ROOT))
            .distinct()
            .toList());
    }

    private static List<Metric> within(List<Metric> metrics, Optional<DateRange> range) {
        if (range.isEmpty()) {
            return new ArrayList<>(metrics);
        }
        List<Metric> selected = new ArrayList<>();
        for (Metric metric : metrics) {
            if (range.get().contains(metric.getCreatedAt())) {
                selected.add(metric);
            }
        }
        return selected;
    }
}
