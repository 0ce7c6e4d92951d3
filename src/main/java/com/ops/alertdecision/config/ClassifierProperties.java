package com.ops.alertdecision.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "classifier")
public class ClassifierProperties {

    private boolean enabled = false;

    // Model-serving endpoint accepting one feature vector per POST
    private String url = "http://localhost:5000/predict";

    private int timeoutMs = 3000;

    // Model labels meaning "suppress"; "suppressed: jira exists" is the legacy spelling
    private List<String> suppressLabels = new ArrayList<>(List.of("suppress", "suppressed: jira exists"));

    public boolean isSuppressLabel(String label) {
        if (label == null) return false;
        return suppressLabels.stream().anyMatch(l -> l.equalsIgnoreCase(label.trim()));
    }
}
