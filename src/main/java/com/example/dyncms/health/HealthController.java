package com.example.dyncms.health;

import com.example.dyncms.schema.ModelRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private final BuildProperties buildProperties;
    private final ModelRegistry modelRegistry;
    private final Clock clock;
    private final String env;

    public HealthController(@Value("${app.env:local}") String env,
                            ObjectProvider<BuildProperties> buildProperties,
                            ModelRegistry modelRegistry,
                            Clock clock) {
        this.env = env;
        this.buildProperties = buildProperties.getIfAvailable();
        this.modelRegistry = modelRegistry;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "ts", Instant.now(clock).toString(),
                "env", env,
                "app", buildProperties != null ? buildProperties.getName() : "dyncms",
                "version", buildProperties != null ? buildProperties.getVersion() : "dev",
                "contentTypes", modelRegistry.size()
        ));
    }
}
