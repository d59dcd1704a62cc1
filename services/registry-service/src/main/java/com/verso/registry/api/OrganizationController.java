package com.verso.registry.api;

import com.verso.registry.domain.org.Organization;
import com.verso.registry.listing.TextValue;
import com.verso.registry.service.OrganizationService;
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
public class OrganizationController extends EntityController<Organization> {

    public OrganizationController(OrganizationService service) {
        super(service, Map.of("statuses", "status"));
    }

    @PostMapping("/organizations")
    public ResponseEntity<Organization> create(@RequestBody Organization body) {
        return created(body);
    }

    @GetMapping("/organizations")
    public List<Organization> list(@RequestParam Map<String, String> query) {
        return service.list(query);
    }

    @GetMapping("/organizations/{id}")
    public Organization read(@PathVariable String id) {
        return service.read(id);
    }

    @RequestMapping(value = "/organizations/{id}", method = RequestMethod.HEAD)
    public ResponseEntity<Void> exists(@PathVariable String id) {
        return head(id);
    }

    @PutMapping("/organizations/{id}")
    public Organization update(@PathVariable String id, @RequestBody Organization body) {
        return service.update(id, body);
    }

    @DeleteMapping("/organizations/{id}")
    public Organization delete(@PathVariable String id) {
        return service.delete(id);
    }

    @GetMapping("/organizations/{id}/versions")
    public List<Organization> versions(@PathVariable String id, @RequestParam Map<String, String> query) {
        return service.versions(id, query);
    }

    @GetMapping("/organizations/{id}/versions/{versionId}")
    public Organization version(@PathVariable String id, @PathVariable String versionId) {
        return service.version(id, versionId);
    }

    @RequestMapping(value = "/organizations/{id}/versions/{versionId}", method = RequestMethod.HEAD)
    public ResponseEntity<Void> versionExists(@PathVariable String id, @PathVariable String versionId) {
        return headVersion(id, versionId);
    }

    @GetMapping("/organization_names")
    public List<TextValue> textValues(@RequestParam Map<String, String> query) {
        return service.listTextValues(query);
    }

    @GetMapping("/organization_{index}")
    public List<String> indexKeys(@PathVariable String index) {
        return listIndexKeys(index);
    }
}
