package com.verso.registry.api;

import com.verso.registry.common.RequestContextHolder;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("service", "registry-service");
        response.put("trace_id", RequestContextHolder.traceId());
        response.put("request_id", RequestContextHolder.requestId());
        return response;
    }
}
