package com.billing.leakdetector.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "leak.inference")
public class InferenceConfig {

    // "heuristic" (built-in billing rules) or "remote" (HTTP model service)
    private String mode = "heuristic";

    // Concurrent calls allowed into the adapter. 1 serializes a single-threaded model.
    private int maxConcurrency = 1;

    // Per-call timeout. 0 calls the adapter on the caller's thread without a deadline.
    private long timeoutMs = 30000;

    private TimeoutPolicy timeoutPolicy = TimeoutPolicy.FATAL;

    private Remote remote = new Remote();

    private Heuristic heuristic = new Heuristic();

    public enum TimeoutPolicy {
        // a timed-out call fails the job
        FATAL,
        // a timed-out call skips the row
        SKIP_ROW
    }

    @Data
    public static class Remote {
        private String baseUrl = "http://localhost:8001";
        private int connectTimeoutMs = 2000;
        private int readTimeoutMs = 30000;
    }

    @Data
    public static class Heuristic {
        private double maxTaxRate = 0.30;
        private double maxRefundRate = 0.50;
        private double maxGatewayFeeRate = 0.05;
        private int maxRetries = 3;
        private double maxRoundingDiff = 0.05;
        private long maxPaymentDelayDays = 60;
        // relative tolerance for invoice_amount + tax_amount - discount_applied == total_amount
        private double totalMismatchTolerance = 0.01;
    }
}
