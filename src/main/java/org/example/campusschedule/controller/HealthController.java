package org.example.campusschedule.controller;

import lombok.RequiredArgsConstructor;
import org.example.campusschedule.repository.DocumentStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private static final int MAX_COLLECTIONS = 10;
    private static final int MAX_ERROR_CHARS = 50;

    private final DocumentStore store;

    @Value("${DATABASE_URL:}")
    private String databaseUrl;

    @Value("${DATABASE_NAME:}")
    private String databaseName;

    @GetMapping("/")
    public ResponseEntity<Map<String, String>> root() {
        return ResponseEntity.ok(Map.of("message", "Student Schedule Organizer API"));
    }

    /**
     * Store diagnostics. Always answers 200, whatever the store state.
     */
    @GetMapping("/test")
    public ResponseEntity<Map<String, Object>> diagnostics() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("backend", "Running");
        out.put("database", "Not Available");
        out.put("database_url", null);
        out.put("database_name", null);
        out.put("connection_status", "Not Connected");
        out.put("collections", List.of());

        if (!store.isAvailable()) {
            return ResponseEntity.ok(out);
        }

        out.put("database", "Available");
        out.put("database_url", isSet(databaseUrl) ? "Set" : "Not Set");
        out.put("database_name", isSet(databaseName) ? "Set" : "Not Set");
        out.put("connection_status", "Connected");
        try {
            List<String> collections = store.listCollectionNames();
            out.put("collections", collections.subList(0, Math.min(MAX_COLLECTIONS, collections.size())));
            out.put("database", "Connected & Working");
        } catch (RuntimeException e) {
            out.put("database", "Connected but Error: " + truncate(e.getMessage()));
        }
        return ResponseEntity.ok(out);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    private static String truncate(String message) {
        if (message == null) {
            return "";
        }
        return message.length() <= MAX_ERROR_CHARS ? message : message.substring(0, MAX_ERROR_CHARS);
    }
}
