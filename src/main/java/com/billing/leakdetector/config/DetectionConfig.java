package com.billing.leakdetector.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "leak.detection")
public class DetectionConfig {

    private SeverityThresholds severity = new SeverityThresholds();

    // Source column holding the row timestamp. Missing or unparseable values leave it null.
    private String timestampColumn = "invoice_date";

    // Features named in the explanation summary.
    private int explanationTopFeatures = 5;

    @Data
    public static class SeverityThresholds {
        // score >= high -> HIGH
        private double high = 0.85;
        // medium <= score < high -> MEDIUM, below -> LOW
        private double medium = 0.5;
    }
}
