package com.verso.registry.api;

import com.verso.registry.domain.token.Token;
import com.verso.registry.listing.TextValue;
import com.verso.registry.service.TokenService;
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
public class TokenController extends EntityController<Token> {

    public TokenController(TokenService service) {
        super(service, Map.of("user_ids", "user"));
    }

    @PostMapping("/tokens")
    public ResponseEntity<Token> create(@RequestBody Token body) {
        return created(body);
    }

    @GetMapping("/tokens")
    public List<Token> list(@RequestParam Map<String, String> query) {
        return service.list(query);
    }

    @GetMapping("/tokens/{id}")
    public Token read(@PathVariable String id) {
        return service.read(id);
    }

    @RequestMapping(value = "/tokens/{id}", method = RequestMethod.HEAD)
    public ResponseEntity<Void> exists(@PathVariable String id) {
        return head(id);
    }

    @DeleteMapping("/tokens/{id}")
    public Token delete(@PathVariable String id) {
        return service.delete(id);
    }

    @GetMapping("/token_emails")
    public List<TextValue> textValues(@RequestParam Map<String, String> query) {
        return service.listTextValues(query);
    }

    @GetMapping("/token_{index}")
    public List<String> indexKeys(@PathVariable String index) {
        return listIndexKeys(index);
    }
}
