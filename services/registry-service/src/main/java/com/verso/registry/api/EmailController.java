package com.verso.registry.api;

import com.verso.registry.domain.email.Email;
import com.verso.registry.listing.TextValue;
import com.verso.registry.service.EmailService;
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
public class EmailController extends EntityController<Email> {

    public EmailController(EmailService service) {
        super(service, Map.of("addresses", "address", "statuses", "status"));
    }

    @PostMapping("/emails")
    public ResponseEntity<Email> create(@RequestBody Email body) {
        return created(body);
    }

    @GetMapping("/emails")
    public List<Email> list(@RequestParam Map<String, String> query) {
        return service.list(query);
    }

    @GetMapping("/emails/{id}")
    public Email read(@PathVariable String id) {
        return service.read(id);
    }

    @RequestMapping(value = "/emails/{id}", method = RequestMethod.HEAD)
    public ResponseEntity<Void> exists(@PathVariable String id) {
        return head(id);
    }

    @PutMapping("/emails/{id}")
    public Email update(@PathVariable String id, @RequestBody Email body) {
        return service.update(id, body);
    }

    @DeleteMapping("/emails/{id}")
    public Email delete(@PathVariable String id) {
        return service.delete(id);
    }

    @GetMapping("/emails/{id}/versions")
    public List<Email> versions(@PathVariable String id, @RequestParam Map<String, String> query) {
        return service.versions(id, query);
    }

    @GetMapping("/emails/{id}/versions/{versionId}")
    public Email version(@PathVariable String id, @PathVariable String versionId) {
        return service.version(id, versionId);
    }

    @RequestMapping(value = "/emails/{id}/versions/{versionId}", method = RequestMethod.HEAD)
    public ResponseEntity<Void> versionExists(@PathVariable String id, @PathVariable String versionId) {
        return headVersion(id, versionId);
    }

    @GetMapping("/email_subjects")
    public List<TextValue> textValues(@RequestParam Map<String, String> query) {
        return service.listTextValues(query);
    }

    @GetMapping("/email_{index}")
    public List<String> indexKeys(@PathVariable String index) {
        return listIndexKeys(index);
    }
}
