package com.billing.leakdetector.model;

/**
 * Output of the inference adapter's scoring function for one row.
 */
public record ScoreResult(double anomalyScore, String label) {}
