package com.billing.leakdetector.service;

import com.billing.leakdetector.config.DetectionConfig;
import com.billing.leakdetector.config.MetricsConfig;
import com.billing.leakdetector.exception.NotFoundException;
import com.billing.leakdetector.inference.InferenceGateway;
import com.billing.leakdetector.model.Anomaly;
import com.billing.leakdetector.model.Explanation;
import com.billing.leakdetector.repository.AnomalyRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lazily computed, permanently cached explanations.
 *
 * <p>Within this process concurrent requests for the same anomaly share one adapter call.
 * Across processes the store's conditional write decides: the first explanation attached wins
 * and every caller returns that one. Failed computations are not cached.
 */
@Service
public class ExplanationService {

    private static final Logger log = LoggerFactory.getLogger(ExplanationService.class);

    private final AnomalyRepository anomalyRepository;
    private final InferenceGateway inferenceGateway;
    private final DetectionConfig detectionConfig;
    private final MetricsConfig metricsConfig;

    private final Map<String, CompletableFuture<Map<String, Double>>> inFlight = new ConcurrentHashMap<>();

    public ExplanationService(AnomalyRepository anomalyRepository,
                              InferenceGateway inferenceGateway,
                              DetectionConfig detectionConfig,
                              MetricsConfig metricsConfig) {
        this.anomalyRepository = anomalyRepository;
        this.inferenceGateway = inferenceGateway;
        this.detectionConfig = detectionConfig;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "explanation.get", contextualName = "explain-anomaly")
    public Explanation explain(String anomalyId) {
        Anomaly anomaly = load(anomalyId);
        if (anomaly.getExplanation() != null) {
            metricsConfig.recordExplanation(true);
            return toExplanation(anomaly, anomaly.getExplanation(), false);
        }

        CompletableFuture<Map<String, Double>> flight = new CompletableFuture<>();
        CompletableFuture<Map<String, Double>> running = inFlight.putIfAbsent(anomalyId, flight);
        if (running != null) {
            log.debug("Joining in-flight explanation of anomaly {}", anomalyId);
            Map<String, Double> shared = await(running);
            metricsConfig.recordExplanation(true);
            return toExplanation(anomaly, shared, false);
        }

        try {
            // an earlier flight may have finished between our read and taking the slot
            Anomaly current = load(anomalyId);
            Map<String, Double> weights = current.getExplanation();
            boolean computed = false;

            if (weights == null) {
                Map<String, Double> normalized = normalize(
                        inferenceGateway.explain(current.getFeatureValues()),
                        current.getFeatureValues().keySet());
                if (anomalyRepository.attachExplanation(anomalyId, normalized)) {
                    weights = normalized;
                    computed = true;
                    log.info("Computed explanation for anomaly {} ({} features)", anomalyId, normalized.size());
                } else {
                    weights = load(anomalyId).getExplanation();
                    log.info("Explanation for anomaly {} was stored by another writer, discarding ours", anomalyId);
                }
            }

            flight.complete(weights);
            metricsConfig.recordExplanation(!computed);
            return toExplanation(current, weights, computed);
        } catch (RuntimeException e) {
            flight.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(anomalyId, flight);
        }
    }

    /**
     * Aligns adapter output with the row's columns: missing features get 0.0, unknown ones are
     * dropped, and non-finite weights become 0.0.
     */
    static Map<String, Double> normalize(Map<String, Double> raw, Set<String> features) {
        Map<String, Double> normalized = new LinkedHashMap<>();
        for (String feature : features) {
            Double weight = raw != null ? raw.get(feature) : null;
            normalized.put(feature, weight != null && Double.isFinite(weight) ? weight : 0.0);
        }
        return normalized;
    }

    private Explanation toExplanation(Anomaly anomaly, Map<String, Double> weights, boolean computed) {
        Map<String, Object> values = anomaly.getFeatureValues();
        List<Explanation.FeatureContribution> contributions = new ArrayList<>();
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            contributions.add(Explanation.FeatureContribution.builder()
                    .feature(entry.getKey())
                    .value(values != null ? values.get(entry.getKey()) : null)
                    .weight(entry.getValue())
                    .build());
        }
        contributions.sort(Comparator.comparingDouble(
                (Explanation.FeatureContribution c) -> Math.abs(c.getWeight())).reversed());

        return Explanation.builder()
                .anomalyId(anomaly.getId())
                .anomalyScore(anomaly.getAnomalyScore())
                .severity(anomaly.getSeverity())
                .contributions(contributions)
                .summary(summarize(anomaly, contributions, detectionConfig.getExplanationTopFeatures()))
                .computed(computed)
                .build();
    }

    static String summarize(Anomaly anomaly, List<Explanation.FeatureContribution> contributions, int topN) {
        List<Explanation.FeatureContribution> top = contributions.stream()
                .filter(c -> c.getWeight() != 0.0)
                .limit(Math.max(0, topN))
                .toList();
        String header = String.format(Locale.ROOT, "Row %d scored %.3f (%s).",
                anomaly.getRowIndex(), anomaly.getAnomalyScore(), anomaly.getSeverity());
        if (top.isEmpty()) {
            return header + " No feature contributed to the score.";
        }

        StringBuilder summary = new StringBuilder(header).append(" Main contributing features:");
        for (Explanation.FeatureContribution c : top) {
            summary.append(String.format(Locale.ROOT, "%n- %s: %s (%s anomaly likelihood by %.3f)",
                    displayName(c.getFeature()),
                    c.getValue() != null ? c.getValue() : "N/A",
                    c.getWeight() > 0 ? "increasing" : "decreasing",
                    Math.abs(c.getWeight())));
        }
        return summary.toString();
    }

    // invoice_amount -> Invoice Amount
    private static String displayName(String feature) {
        StringBuilder name = new StringBuilder();
        for (String word : feature.split("_")) {
            if (word.isEmpty()) continue;
            if (name.length() > 0) name.append(' ');
            name.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return name.length() > 0 ? name.toString() : feature;
    }

    private Anomaly load(String anomalyId) {
        return anomalyRepository.findById(anomalyId)
                .orElseThrow(() -> new NotFoundException("Anomaly", anomalyId));
    }

    private static Map<String, Double> await(CompletableFuture<Map<String, Double>> flight) {
        try {
            return flight.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
