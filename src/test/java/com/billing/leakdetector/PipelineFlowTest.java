package com.billing.leakdetector;

import com.billing.leakdetector.testutil.TestDataFactory;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Register, process, review and explain a dataset through the HTTP API with the heuristic model
 * and in-memory storage.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class PipelineFlowTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void uploadProcessReviewAndExplain() throws Exception {
        List<Map<String, Object>> rows = TestDataFactory.createBillingRows(5);
        rows.get(3).put("total_amount", 2500.0);

        String uploadId = JsonPath.parse(post("/api/v1/uploads",
                Map.of("filename", "billing_q1.csv", "rows", rows), HttpStatus.CREATED)).read("$.id");

        String jobId = JsonPath.parse(post("/api/v1/process/" + uploadId, null, HttpStatus.ACCEPTED)).read("$.jobId");
        DocumentContext job = awaitFinished(jobId);
        assertThat(job.read("$.status", String.class)).isEqualTo("COMPLETED");
        assertThat(job.read("$.progress", Integer.class)).isEqualTo(100);
        assertThat(job.read("$.anomaliesFound", Integer.class)).isEqualTo(5);

        DocumentContext page = JsonPath.parse(restTemplate.getForObject(
                "/api/v1/uploads/" + uploadId + "/anomalies?limit=10", String.class));
        assertThat(page.read("$.total", Integer.class)).isEqualTo(5);
        assertThat(page.read("$.data[0].rowIndex", Integer.class)).isEqualTo(3);
        assertThat(page.read("$.data[0].severity", String.class)).isEqualTo("HIGH");
        String anomalyId = page.read("$.data[0].id");

        DocumentContext explanation = JsonPath.parse(restTemplate.getForObject(
                "/api/v1/anomalies/" + anomalyId + "/explanation", String.class));
        assertThat(explanation.read("$.computed", Boolean.class)).isTrue();
        assertThat(explanation.read("$.contributions[0].feature", String.class)).isEqualTo("total_amount");
        DocumentContext cached = JsonPath.parse(restTemplate.getForObject(
                "/api/v1/anomalies/" + anomalyId + "/explanation", String.class));
        assertThat(cached.read("$.computed", Boolean.class)).isFalse();

        post("/api/v1/anomalies/" + anomalyId + "/actions",
                Map.of("actionType", "create_work_order", "notes", "WO-77", "createdBy", "ops"), HttpStatus.CREATED);
        post("/api/v1/anomalies/" + anomalyId + "/actions",
                Map.of("actionType", "mark_reviewed"), HttpStatus.CREATED);
        DocumentContext anomaly = JsonPath.parse(restTemplate.getForObject(
                "/api/v1/anomalies/" + anomalyId, String.class));
        assertThat(anomaly.read("$.status", String.class)).isEqualTo("ACTIONED");
        List<Object> actions = JsonPath.parse(restTemplate.getForObject(
                "/api/v1/anomalies/" + anomalyId + "/actions", String.class)).read("$");
        assertThat(actions).hasSize(2);

        DocumentContext metrics = JsonPath.parse(restTemplate.getForObject("/api/v1/dashboard/metrics", String.class));
        assertThat(metrics.read("$.totalAnomalies", Integer.class)).isGreaterThanOrEqualTo(5);
        assertThat(metrics.read("$.highSeverityCount", Integer.class)).isGreaterThanOrEqualTo(1);

        ResponseEntity<String> deleted = restTemplate.exchange("/api/v1/uploads/" + uploadId,
                HttpMethod.DELETE, null, String.class);
        assertThat(deleted.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
        assertThat(restTemplate.getForEntity("/api/v1/anomalies/" + anomalyId, String.class).getStatusCode())
                .isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void unknownUpload_returnsNotFoundError() {
        ResponseEntity<String> response = restTemplate.postForEntity("/api/v1/process/does-not-exist", null, String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(JsonPath.parse(response.getBody()).read("$.code", String.class)).isEqualTo("NOT_FOUND");
    }

    private String post(String path, Object body, HttpStatus expected) {
        ResponseEntity<String> response = restTemplate.postForEntity(path, body, String.class);
        assertThat(response.getStatusCode()).isEqualTo(expected);
        return response.getBody();
    }

    private DocumentContext awaitFinished(String jobId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        DocumentContext job;
        do {
            job = JsonPath.parse(restTemplate.getForObject("/api/v1/process/status/" + jobId, String.class));
            String status = job.read("$.status");
            if (status.equals("COMPLETED") || status.equals("FAILED")) {
                return job;
            }
            Thread.sleep(50);
        } while (System.currentTimeMillis() < deadline);
        return job;
    }
}
