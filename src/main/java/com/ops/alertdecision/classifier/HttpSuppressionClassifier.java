package com.ops.alertdecision.classifier;

import com.ops.alertdecision.config.ClassifierProperties;
import com.ops.alertdecision.exception.ClassifierException;
import com.ops.alertdecision.model.AlertFeatures;
import com.ops.alertdecision.model.ClassifierPrediction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Calls a model-serving endpoint with one feature vector per request.
 *
 * <p>Request body: {@code {"source", "host", "severity", "status", "created_at", "resolved_at"}} with
 * timestamps as ISO-8601 strings and unset fields as JSON null.
 *
 * <p>Accepted responses: {@code predicted_label} plus {@code predicted_label_probs}, given either
 * as a list of {@code {"label", "prob"}} objects or as a label-to-probability map. Model labels are
 * mapped onto the canonical suppress/keep pair using {@code classifier.suppress-labels}.
 */
@Component
@ConditionalOnProperty(name = "classifier.enabled", havingValue = "true")
public class HttpSuppressionClassifier implements SuppressionClassifier {

    private static final Logger log = LoggerFactory.getLogger(HttpSuppressionClassifier.class);

    private static final double PROBABILITY_TOLERANCE = 1e-6;

    private final ClassifierProperties properties;
    private final RestTemplate restTemplate;

    @Autowired
    public HttpSuppressionClassifier(ClassifierProperties properties) {
        this(properties, timedRestTemplate(properties.getTimeoutMs()));
    }

    HttpSuppressionClassifier(ClassifierProperties properties, RestTemplate restTemplate) {
        this.properties = properties;
        this.restTemplate = restTemplate;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    @SuppressWarnings("unchecked")
    public ClassifierPrediction predict(AlertFeatures features) {
        Map<String, Object> response;
        try {
            response = restTemplate.postForObject(properties.getUrl(), requestBody(features), Map.class);
        } catch (RestClientException e) {
            throw new ClassifierException("Classifier call to " + properties.getUrl() + " failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new ClassifierException("Classifier returned an empty response");
        }
        ClassifierPrediction prediction = parse(response);
        log.debug("Classifier predicted {} ({}) for host {}", prediction.getPredictedLabel(),
                prediction.getPredictedProbability(), features.getHost());
        return prediction;
    }

    Map<String, Object> requestBody(AlertFeatures features) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("source", features.getSource());
        body.put("host", features.getHost());
        body.put("severity", features.getSeverity());
        body.put("status", features.getStatus());
        body.put("created_at", features.getCreatedAt() != null ? features.getCreatedAt().toString() : null);
        body.put("resolved_at", features.getResolvedAt() != null ? features.getResolvedAt().toString() : null);
        return body;
    }

    ClassifierPrediction parse(Map<String, Object> response) {
        Object label = response.get("predicted_label");
        if (!(label instanceof String) || ((String) label).isBlank()) {
            throw new ClassifierException("Classifier response missing predicted_label");
        }

        Map<String, Double> raw = rawProbabilities(response.get("predicted_label_probs"));
        double sum = 0.0;
        for (Map.Entry<String, Double> e : raw.entrySet()) {
            double p = e.getValue();
            if (Double.isNaN(p) || p < 0.0 || p > 1.0) {
                throw new ClassifierException("Probability for label '" + e.getKey() + "' outside [0,1]: " + p);
            }
            sum += p;
        }
        if (sum > 1.0 + PROBABILITY_TOLERANCE) {
            throw new ClassifierException("Label probabilities sum to " + sum);
        }

        // folded labels keep the highest single probability; the predicted label's own value wins
        String predicted = (String) label;
        Map<String, Double> canonical = new HashMap<>();
        raw.forEach((l, p) -> canonical.merge(canonicalLabel(l), p, Math::max));
        if (raw.containsKey(predicted)) {
            canonical.put(canonicalLabel(predicted), raw.get(predicted));
        }

        return ClassifierPrediction.builder()
                .predictedLabel(canonicalLabel(predicted))
                .labelProbabilities(Map.copyOf(canonical))
                .build();
    }

    private String canonicalLabel(String modelLabel) {
        return properties.isSuppressLabel(modelLabel) ? ClassifierPrediction.SUPPRESS : ClassifierPrediction.KEEP;
    }

    private static Map<String, Double> rawProbabilities(Object probs) {
        Map<String, Double> result = new LinkedHashMap<>();
        if (probs == null) {
            return result;
        }
        if (probs instanceof List<?> list) {
            for (Object item : list) {
                if (!(item instanceof Map<?, ?> entry) || !(entry.get("label") instanceof String l)) {
                    throw new ClassifierException("Malformed entry in predicted_label_probs: " + item);
                }
                result.put(l, toDouble(entry.get("prob"), l));
            }
            return result;
        }
        if (probs instanceof Map<?, ?> map) {
            map.forEach((k, v) -> result.put(String.valueOf(k), toDouble(v, String.valueOf(k))));
            return result;
        }
        throw new ClassifierException("Unsupported predicted_label_probs shape: " + probs.getClass().getSimpleName());
    }

    private static double toDouble(Object value, String label) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(value));
        } catch (NumberFormatException e) {
            throw new ClassifierException("Non-numeric probability for label '" + label + "': " + value, e);
        }
    }

    private static RestTemplate timedRestTemplate(int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }
}
