package com.billing.leakdetector.contract;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Guards the published OpenAPI document against accidental path and schema drift.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        DocumentContext json = JsonPath.parse(restTemplate.getForObject("/v3/api-docs", String.class));
        Map<String, Object> paths = json.read("$.paths");

        // Uploads
        assertThat(paths).containsKey("/api/v1/uploads");
        assertThat(paths).containsKey("/api/v1/uploads/{uploadId}");
        assertThat(paths).containsKey("/api/v1/uploads/{uploadId}/jobs");
        assertThat(paths).containsKey("/api/v1/uploads/{uploadId}/anomalies");

        // Processing
        assertThat(paths).containsKey("/api/v1/process/{uploadId}");
        assertThat(paths).containsKey("/api/v1/process/status/{jobId}");
        assertThat(paths).containsKey("/api/v1/process/{jobId}/cancel");

        // Anomalies
        assertThat(paths).containsKey("/api/v1/anomalies/{anomalyId}");
        assertThat(paths).containsKey("/api/v1/anomalies/{anomalyId}/explanation");
        assertThat(paths).containsKey("/api/v1/anomalies/{anomalyId}/actions");

        // Dashboard
        assertThat(paths).containsKey("/api/v1/dashboard/metrics");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        DocumentContext json = JsonPath.parse(restTemplate.getForObject("/v3/api-docs", String.class));
        Map<String, Object> schemas = json.read("$.components.schemas");

        assertThat(schemas).containsKeys("Upload", "Job", "Anomaly", "Explanation", "Action",
                "AggregationSnapshot", "ErrorResponse", "ProcessResponse");

        Map<String, Object> jobProperties = json.read("$.components.schemas.Job.properties");
        assertThat(jobProperties).containsKeys("status", "progress", "anomaliesFound", "errorMessage");
    }
}
