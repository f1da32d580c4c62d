package com.billing.leakdetector.inference;

import com.billing.leakdetector.config.InferenceConfig;
import com.billing.leakdetector.exception.AdapterUnavailableException;
import com.billing.leakdetector.exception.InvalidRowException;
import com.billing.leakdetector.model.ScoreResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;

/**
 * Delegates to an external model service over JSON/HTTP.
 *
 * <pre>
 * POST /score   {"features": {...}}  ->  {"anomaly_score": 0.91, "label": "anomaly"}
 * POST /explain {"features": {...}}  ->  {"explanation": {"feature": weight, ...}}
 * </pre>
 *
 * 400 and 422 mean the row was rejected. Anything else that is not a 2xx, and any I/O
 * failure, means the service is unavailable.
 */
@Component
@ConditionalOnProperty(name = "leak.inference.mode", havingValue = "remote")
public class RemoteModelInferenceAdapter implements InferenceAdapter {

    private static final Logger log = LoggerFactory.getLogger(RemoteModelInferenceAdapter.class);

    private final RestClient restClient;

    @Autowired
    public RemoteModelInferenceAdapter(RestClient.Builder builder, InferenceConfig config) {
        InferenceConfig.Remote remote = config.getRemote();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(remote.getConnectTimeoutMs());
        requestFactory.setReadTimeout(remote.getReadTimeoutMs());

        this.restClient = builder
                .baseUrl(remote.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
        log.info("Remote inference adapter targeting {}", remote.getBaseUrl());
    }

    RemoteModelInferenceAdapter(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public ScoreResult score(Map<String, Object> row) {
        ScoreResponse response = post("/score", row, ScoreResponse.class);
        if (response.anomalyScore() == null) {
            throw new AdapterUnavailableException("Model service returned a score response without anomaly_score");
        }
        return new ScoreResult(response.anomalyScore(), response.label());
    }

    @Override
    public Map<String, Double> explain(Map<String, Object> row) {
        ExplainResponse response = post("/explain", row, ExplainResponse.class);
        if (response.explanation() == null) {
            throw new AdapterUnavailableException("Model service returned an explain response without explanation");
        }
        return response.explanation();
    }

    @Override
    public String name() {
        return "remote";
    }

    private <T> T post(String path, Map<String, Object> row, Class<T> responseType) {
        T response;
        try {
            response = restClient.post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new ModelRequest(row))
                    .retrieve()
                    .body(responseType);
        } catch (HttpClientErrorException e) {
            int status = e.getStatusCode().value();
            if (status == 400 || status == 422) {
                throw new InvalidRowException("Model service rejected the row: " + e.getResponseBodyAsString(), e);
            }
            throw new AdapterUnavailableException("Model service returned HTTP " + status + " for " + path, e);
        } catch (HttpServerErrorException e) {
            throw new AdapterUnavailableException("Model service returned HTTP " + e.getStatusCode().value()
                    + " for " + path, e);
        } catch (ResourceAccessException e) {
            throw new AdapterUnavailableException("Model service unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new AdapterUnavailableException("Model service call to " + path + " failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new AdapterUnavailableException("Model service returned an empty body for " + path);
        }
        return response;
    }

    record ModelRequest(Map<String, Object> features) {}

    record ScoreResponse(@JsonProperty("anomaly_score") Double anomalyScore, String label) {}

    record ExplainResponse(Map<String, Double> explanation) {}
}
