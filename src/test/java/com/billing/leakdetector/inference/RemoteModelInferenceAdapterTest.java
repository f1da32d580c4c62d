package com.billing.leakdetector.inference;

import com.billing.leakdetector.exception.AdapterUnavailableException;
import com.billing.leakdetector.exception.InvalidRowException;
import com.billing.leakdetector.model.ScoreResult;
import com.billing.leakdetector.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class RemoteModelInferenceAdapterTest {

    private MockRestServiceServer server;
    private RemoteModelInferenceAdapter adapter;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://model.local");
        server = MockRestServiceServer.bindTo(builder).build();
        adapter = new RemoteModelInferenceAdapter(builder.build());
    }

    @Test
    void score_postsFeaturesAndReadsSnakeCaseScore() {
        server.expect(requestTo("http://model.local/score"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.features.invoice_id").value("INV-7"))
                .andRespond(withSuccess("{\"anomaly_score\": 0.91, \"label\": \"anomaly\"}", MediaType.APPLICATION_JSON));

        ScoreResult result = adapter.score(TestDataFactory.createBillingRow("INV-7", 100.0));

        assertThat(result.anomalyScore()).isEqualTo(0.91);
        assertThat(result.label()).isEqualTo("anomaly");
        server.verify();
    }

    @Test
    void explain_returnsContributionMap() {
        server.expect(requestTo("http://model.local/explain"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("{\"explanation\": {\"total_amount\": 0.62, \"retries\": -0.05}}",
                        MediaType.APPLICATION_JSON));

        Map<String, Double> explanation = adapter.explain(TestDataFactory.createBillingRow("INV-7", 100.0));

        assertThat(explanation).containsEntry("total_amount", 0.62).containsEntry("retries", -0.05);
    }

    @Test
    void score_unprocessableRow_throwsInvalidRow() {
        server.expect(requestTo("http://model.local/score"))
                .andRespond(withStatus(HttpStatus.UNPROCESSABLE_ENTITY)
                        .body("{\"detail\": \"invoice_amount missing\"}")
                        .contentType(MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> adapter.score(Map.of("retries", 1)))
                .isInstanceOf(InvalidRowException.class)
                .hasMessageContaining("invoice_amount missing");
    }

    @Test
    void score_serverError_throwsAdapterUnavailable() {
        server.expect(requestTo("http://model.local/score"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> adapter.score(Map.of("retries", 1)))
                .isInstanceOf(AdapterUnavailableException.class)
                .hasMessageContaining("HTTP 500");
    }

    @Test
    void score_connectionFailure_throwsAdapterUnavailable() {
        server.expect(requestTo("http://model.local/score"))
                .andRespond(withException(new IOException("Connection refused")));

        assertThatThrownBy(() -> adapter.score(Map.of("retries", 1)))
                .isInstanceOf(AdapterUnavailableException.class)
                .hasMessageContaining("unreachable");
    }

    @Test
    void score_responseWithoutScore_throwsAdapterUnavailable() {
        server.expect(requestTo("http://model.local/score"))
                .andRespond(withSuccess("{\"label\": \"anomaly\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> adapter.score(Map.of("retries", 1)))
                .isInstanceOf(AdapterUnavailableException.class)
                .hasMessageContaining("anomaly_score");
    }
}
