package com.verso.registry.api;

import com.verso.registry.domain.content.Content;
import com.verso.registry.listing.TextValue;
import com.verso.registry.service.ContentService;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
public class ContentController extends EntityController<Content> {

    public ContentController(ContentService service) {
        super(service, Map.of("types", "type", "authors", "author", "editors", "editor", "tags", "tag"));
    }

    @PostMapping("/contents")
    public ResponseEntity<Content> create(@RequestBody Content body) {
        return created(body);
    }

    @GetMapping("/contents")
    public List<Content> list(@RequestParam Map<String, String> query) {
        return service.list(query);
    }

    @GetMapping("/contents/{id}")
    public Content read(@PathVariable String id) {
        return service.read(id);
    }

    @RequestMapping(value = "/contents/{id}", method = RequestMethod.HEAD)
    public ResponseEntity<Void> exists(@PathVariable String id) {
        return head(id);
    }

    @PutMapping("/contents/{id}")
    public Content update(@PathVariable String id, @RequestBody Content body) {
        return service.update(id, body);
    }

    @DeleteMapping("/contents/{id}")
    public Content delete(@PathVariable String id) {
        return service.delete(id);
    }

    @GetMapping("/contents/{id}/versions")
    public List<Content> versions(@PathVariable String id, @RequestParam Map<String, String> query) {
        return service.versions(id, query);
    }

    @GetMapping("/contents/{id}/versions/{versionId}")
    public Content version(@PathVariable String id, @PathVariable String versionId) {
        return service.version(id, versionId);
    }

    @RequestMapping(value = "/contents/{id}/versions/{versionId}", method = RequestMethod.HEAD)
    public ResponseEntity<Void> versionExists(@PathVariable String id, @PathVariable String versionId) {
        return headVersion(id, versionId);
    }

    @GetMapping("/content_titles")
    public List<TextValue> textValues(@RequestParam Map<String, String> query) {
        return service.listTextValues(query);
    }

    @GetMapping("/content_{index}")
    public List<String> indexKeys(@PathVariable String index) {
        return listIndexKeys(index);
    }
}
