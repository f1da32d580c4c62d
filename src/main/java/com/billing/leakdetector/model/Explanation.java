package com.billing.leakdetector.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Cached per-feature explanation of an anomaly score")
public class Explanation {

    private String anomalyId;
    private double anomalyScore;
    private Severity severity;

    @Schema(description = "Contributions ordered by absolute weight, largest first")
    private List<FeatureContribution> contributions;

    @Schema(description = "Readable summary of the strongest contributions")
    private String summary;

    @Schema(description = "False when the explanation was served from the cache")
    private boolean computed;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FeatureContribution {
        private String feature;
        private Object value;
        private double weight;
    }
}
