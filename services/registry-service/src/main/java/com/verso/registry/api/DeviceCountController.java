package com.verso.registry.api;

import com.verso.registry.domain.device.DeviceCount;
import com.verso.registry.service.DeviceCountService;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/device_counts")
public class DeviceCountController {
    private final DeviceCountService service;

    public DeviceCountController(DeviceCountService service) {
        this.service = service;
    }

    @GetMapping
    public List<DeviceCount> list(@RequestParam Map<String, String> query) {
        return service.list(query);
    }

    @GetMapping("/{date}")
    public DeviceCount read(@PathVariable String date) {
        return service.read(date);
    }

    @RequestMapping(value = "/{date}", method = RequestMethod.HEAD)
    public ResponseEntity<Void> exists(@PathVariable String date) {
        return service.exists(date) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    @PutMapping("/{date}")
    public DeviceCount update(@PathVariable String date) {
        return service.update(date);
    }
}
