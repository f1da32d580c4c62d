package com.billing.leakdetector.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Registered billing dataset. Rows are stored separately and never change after registration")
public class Upload {

    @Schema(description = "Upload ID", example = "0f8fad5b-d9cb-469f-a165-70867728950e")
    private String id;

    @Schema(description = "Original file name", example = "billing_2024_q1.csv")
    private String filename;

    @Schema(description = "Number of rows in the dataset", example = "1500")
    private int rowsCount;

    @Schema(description = "Number of distinct columns across all rows", example = "24")
    private int columnsCount;

    @Schema(description = "Registration timestamp in epoch milliseconds")
    private long uploadedAt;
}
