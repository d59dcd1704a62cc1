package com.verso.registry.api;

import com.verso.registry.domain.user.User;
import com.verso.registry.listing.TextValue;
import com.verso.registry.service.UserService;
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
public class UserController extends EntityController<User> {
    private final UserService userService;

    public UserController(UserService service) {
        super(service, Map.of("emails", "email", "orgs", "org", "roles", "role", "statuses", "status"));
        this.userService = service;
    }

    @PostMapping("/users")
    public ResponseEntity<User> create(@RequestBody User body) {
        return created(body);
    }

    @GetMapping("/users")
    public List<User> list(@RequestParam Map<String, String> query) {
        return service.list(query);
    }

    @GetMapping("/users/{id}")
    public User read(@PathVariable String id) {
        return service.read(id);
    }

    @RequestMapping(value = "/users/{id}", method = RequestMethod.HEAD)
    public ResponseEntity<Void> exists(@PathVariable String id) {
        return head(id);
    }

    @PutMapping("/users/{id}")
    public User update(@PathVariable String id, @RequestBody User body) {
        return service.update(id, body);
    }

    @DeleteMapping("/users/{id}")
    public User delete(@PathVariable String id) {
        return service.delete(id);
    }

    @GetMapping("/users/{id}/versions")
    public List<User> versions(@PathVariable String id, @RequestParam Map<String, String> query) {
        return service.versions(id, query);
    }

    @GetMapping("/users/{id}/versions/{versionId}")
    public User version(@PathVariable String id, @PathVariable String versionId) {
        return service.version(id, versionId);
    }

    @RequestMapping(value = "/users/{id}/versions/{versionId}", method = RequestMethod.HEAD)
    public ResponseEntity<Void> versionExists(@PathVariable String id, @PathVariable String versionId) {
        return headVersion(id, versionId);
    }

    @DeleteMapping("/users/{id}/versions/{versionId}")
    public User deleteVersion(@PathVariable String id, @PathVariable String versionId) {
        return service.deleteVersion(id, versionId);
    }

    @GetMapping("/user_ids")
    public List<String> idsByEmail(@RequestParam(required = false) String email) {
        return userService.idsByEmail(email);
    }

    @GetMapping("/user_names")
    public List<TextValue> textValues(@RequestParam Map<String, String> query) {
        return service.listTextValues(query);
    }

    @GetMapping("/user_{index}")
    public List<String> indexKeys(@PathVariable String index) {
        return listIndexKeys(index);
    }
}
