package com.billing.leakdetector.engine;

import com.billing.leakdetector.config.DetectionConfig;
import com.billing.leakdetector.model.Severity;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SeverityPolicyTest {

    private final SeverityPolicy policy = new SeverityPolicy(new DetectionConfig());

    @Test
    void classify_boundaries() {
        assertThat(policy.classify(0.85)).isEqualTo(Severity.HIGH);
        assertThat(policy.classify(0.84999)).isEqualTo(Severity.MEDIUM);
        assertThat(policy.classify(0.5)).isEqualTo(Severity.MEDIUM);
        assertThat(policy.classify(0.49999)).isEqualTo(Severity.LOW);
    }

    @Test
    void classify_extremes() {
        assertThat(policy.classify(1.0)).isEqualTo(Severity.HIGH);
        assertThat(policy.classify(0.0)).isEqualTo(Severity.LOW);
    }

    @Test
    void classify_usesConfiguredThresholds() {
        DetectionConfig config = new DetectionConfig();
        config.getSeverity().setHigh(0.9);
        config.getSeverity().setMedium(0.6);
        SeverityPolicy custom = new SeverityPolicy(config);

        assertThat(custom.classify(0.85)).isEqualTo(Severity.MEDIUM);
        assertThat(custom.classify(0.55)).isEqualTo(Severity.LOW);
    }
}
