package io.contextrunr.channel;

import io.contextrunr.storage.RecordStore;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api")
public class HealthController {

    private final RecordStore recordStore;

    public HealthController(RecordStore recordStore) {
        this.recordStore = recordStore;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        if (!recordStore.healthCheck()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("status", "degraded", "service", "contextrunr"));
        }
        return ResponseEntity.ok(Map.of("status", "ok", "service", "contextrunr"));
    }
}
