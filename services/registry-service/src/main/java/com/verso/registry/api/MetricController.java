package com.verso.registry.api;

import com.verso.registry.domain.metric.Metric;
import com.verso.registry.domain.metric.MetricStat;
import com.verso.registry.listing.TextValue;
import com.verso.registry.service.MetricService;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
public class MetricController extends EntityController<Metric> {
    private final MetricService metricService;

    public MetricController(MetricService service) {
        super(service, Map.of("entity_ids", "entity", "entity_types", "entity_type", "tags", "tag"));
        this.metricService = service;
    }

    @GetMapping("/metric_stats")
    public MetricStat stats(@RequestParam Map<String, String> query) {
        return metricService.stats(query);
    }

    @PostMapping("/metrics")
    public ResponseEntity<Metric> create(@RequestBody Metric body) {
        return created(body);
    }

    @GetMapping("/metrics")
    public List<Metric> list(@RequestParam Map<String, String> query) {
        return service.list(query);
    }

    @GetMapping("/metrics/{id}")
    public Metric read(@PathVariable String id) {
        return service.read(id);
    }

    @RequestMapping(value = "/metrics/{id}", method = RequestMethod.HEAD)
    public ResponseEntity<Void> exists(@PathVariable String id) {
        return head(id);
    }

    @DeleteMapping("/metrics/{id}")
    public Metric delete(@PathVariable String id) {
        return service.delete(id);
    }

    @GetMapping("/metric_titles")
    public List<TextValue> textValues(@RequestParam Map<String, String> query) {
        return service.listTextValues(query);
    }

    @GetMapping("/metric_{index}")
    public List<String> indexKeys(@PathVariable String index) {
        return listIndexKeys(index);
    }
}
