package com.taxdesk.engine.health;

import com.taxdesk.engine.tables.TaxTableRegistry;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight health endpoint. Reports the tax year the engine loaded at startup so a
 * deployment with the wrong tables is visible without running a calculation.
 */
@RestController
public class HealthzController {

    private final TaxTableRegistry tableRegistry;

    public HealthzController(TaxTableRegistry tableRegistry) {
        this.tableRegistry = tableRegistry;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> healthz() {
        return Map.of(
                "status", "UP",
                "taxYear", String.valueOf(tableRegistry.defaultYear())
        );
    }
}
