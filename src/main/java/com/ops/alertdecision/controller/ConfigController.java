package com.ops.alertdecision.controller;

import com.ops.alertdecision.config.AlertSettings;
import com.ops.alertdecision.config.ClassifierProperties;
import com.ops.alertdecision.config.NotificationConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View the effective decision configuration")
public class ConfigController {

    private final AlertSettings settings;
    private final ClassifierProperties classifierProperties;
    private final NotificationConfig notificationConfig;
    private final String auditStore;

    public ConfigController(AlertSettings settings,
                            ClassifierProperties classifierProperties,
                            NotificationConfig notificationConfig,
                            @Value("${audit.store:memory}") String auditStore) {
        this.settings = settings;
        this.classifierProperties = classifierProperties;
        this.notificationConfig = notificationConfig;
        this.auditStore = auditStore;
    }

    @Operation(summary = "Get decision settings",
            description = "Settings are loaded once at startup and are read-only while the service runs.")
    @GetMapping("/settings")
    public ResponseEntity<Map<String, Object>> getSettings() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("settings", settings);
        body.put("classifierEnabled", classifierProperties.isEnabled());
        body.put("classifierSuppressLabels", classifierProperties.getSuppressLabels());
        body.put("notificationChannel", notificationConfig.getChannel());
        body.put("auditStore", auditStore);
        return ResponseEntity.ok(body);
    }
}
