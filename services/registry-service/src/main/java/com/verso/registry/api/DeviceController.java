package com.verso.registry.api;

import com.verso.registry.domain.device.Device;
import com.verso.registry.listing.TextValue;
import com.verso.registry.service.DeviceService;
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
public class DeviceController extends EntityController<Device> {

    public DeviceController(DeviceService service) {
        super(service, Map.of("user_ids", "user", "dates", "date"));
    }

    @PostMapping("/devices")
    public ResponseEntity<Device> create(@RequestBody Device body) {
        return created(body);
    }

    @GetMapping("/devices")
    public List<Device> list(@RequestParam Map<String, String> query) {
        return service.list(query);
    }

    @GetMapping("/devices/{id}")
    public Device read(@PathVariable String id) {
        return service.read(id);
    }

    @RequestMapping(value = "/devices/{id}", method = RequestMethod.HEAD)
    public ResponseEntity<Void> exists(@PathVariable String id) {
        return head(id);
    }

    @PutMapping("/devices/{id}")
    public Device update(@PathVariable String id, @RequestBody Device body) {
        return service.update(id, body);
    }

    @DeleteMapping("/devices/{id}")
    public Device delete(@PathVariable String id) {
        return service.delete(id);
    }

    @GetMapping("/devices/{id}/versions")
    public List<Device> versions(@PathVariable String id, @RequestParam Map<String, String> query) {
        return service.versions(id, query);
    }

    @GetMapping("/devices/{id}/versions/{versionId}")
    public Device version(@PathVariable String id, @PathVariable String versionId) {
        return service.version(id, versionId);
    }

    @RequestMapping(value = "/devices/{id}/versions/{versionId}", method = RequestMethod.HEAD)
    public ResponseEntity<Void> versionExists(@PathVariable String id, @PathVariable String versionId) {
        return headVersion(id, versionId);
    }

    @DeleteMapping("/devices/{id}/versions/{versionId}")
    public Device deleteVersion(@PathVariable String id, @PathVariable String versionId) {
        return service.deleteVersion(id, versionId);
    }

    @GetMapping("/device_agents")
    public List<TextValue> textValues(@RequestParam Map<String, String> query) {
        return service.listTextValues(query);
    }

    @GetMapping("/device_{index}")
    public List<String> indexKeys(@PathVariable String index) {
        return listIndexKeys(index);
    }
}
