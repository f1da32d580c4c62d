package com.billing.leakdetector.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI leakDetectorOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Leak Detector API")
                        .version("0.1.0")
                        .description(
                                "Asynchronous anomaly detection for billing datasets.\n\n" +
                                "**Processing Pipeline:**\n" +
                                "1. Register a dataset via `POST /uploads`\n" +
                                "2. Start a job via `POST /process/{uploadId}` (one active job per upload)\n" +
                                "3. Poll `GET /process/status/{jobId}` until COMPLETED or FAILED\n" +
                                "4. Browse scored rows via `GET /uploads/{uploadId}/anomalies`, highest score first\n" +
                                "5. Fetch `GET /anomalies/{id}/explanation`, computed on first request and cached\n" +
                                "6. Record dispositions via `POST /anomalies/{id}/actions`\n\n" +
                                "**Severity:** HIGH (score >= 0.85), MEDIUM (0.5-0.85), LOW (< 0.5)")
                        .contact(new Contact().name("Billing Assurance Team")));
    }
}
