package com.verso.registry.api;

import com.verso.registry.domain.event.Event;
import com.verso.registry.listing.TextValue;
import com.verso.registry.service.EventService;
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
public class EventController extends EntityController<Event> {

    public EventController(EventService service) {
        super(service, Map.of(
            "entity_ids", "entity",
            "entity_types", "entity_type",
            "log_levels", "log_level",
            "dates", "date"
        ));
    }

    @PostMapping("/events")
    public ResponseEntity<Event> create(@RequestBody Event body) {
        return created(body);
    }

    @GetMapping("/events")
    public List<Event> list(@RequestParam Map<String, String> query) {
        return service.list(query);
    }

    @GetMapping("/events/{id}")
    public Event read(@PathVariable String id) {
        return service.read(id);
    }

    @RequestMapping(value = "/events/{id}", method = RequestMethod.HEAD)
    public ResponseEntity<Void> exists(@PathVariable String id) {
        return head(id);
    }

    @DeleteMapping("/events/{id}")
    public Event delete(@PathVariable String id) {
        return service.delete(id);
    }

    @GetMapping("/event_messages")
    public List<TextValue> textValues(@RequestParam Map<String, String> query) {
        return service.listTextValues(query);
    }

    @GetMapping("/event_{index}")
    public List<String> indexKeys(@PathVariable String index) {
        return listIndexKeys(index);
    }
}
