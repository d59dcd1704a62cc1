package com.verso.registry.domain.metric;

import java.util.List;

/**
 * Summary statistics over a set of metric values.
 */
public record MetricStat(String filter, String key, long count, double sum, Double min, Double max, Double mean) {

    public static MetricStat of(String filter, String key, List<Metric> metrics) {
        if (metrics.isEmpty()) {
            return new MetricStat(filter, key, 0, 0.0, null, null, null);
        }
        double sum = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (Metric metric : metrics) {
            double value = metric.getValue();
            sum += value;
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        return new MetricStat(filter, key, metrics.size(), sum, min, max, sum / metrics.size());
    }
}
