package com.example.prodsched.common;

import com.example.prodsched.scenario.ScenarioCatalog;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    private final ScenarioCatalog catalog;

    public HealthController(ScenarioCatalog catalog) {
        this.catalog = catalog;
    }

    @GetMapping("/api/health")
    public ResponseEntity<ApiResponse<Map<String, Object>>> health() {
        return ResponseEntity.ok(ApiResponse.success("OK",
                Map.of("status", "UP", "scenarios", catalog.list().size())));
    }
}
