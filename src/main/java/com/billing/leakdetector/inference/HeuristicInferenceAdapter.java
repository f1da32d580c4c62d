package com.billing.leakdetector.inference;

import com.billing.leakdetector.config.InferenceConfig;
import com.billing.leakdetector.engine.RowValues;
import com.billing.leakdetector.exception.InvalidRowException;
import com.billing.leakdetector.model.ScoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic billing-rule model. Each check compares an observed ratio against its
 * configured limit; a check contributes nothing up to the limit and saturates at twice the
 * limit. The score combines the weighted checks as independent evidence:
 * {@code 1 - prod(1 - weight * excess)}.
 */
@Component
@ConditionalOnProperty(name = "leak.inference.mode", havingValue = "heuristic", matchIfMissing = true)
public class HeuristicInferenceAdapter implements InferenceAdapter {

    private static final Logger log = LoggerFactory.getLogger(HeuristicInferenceAdapter.class);

    static final String INVOICE_AMOUNT = "invoice_amount";
    static final String TAX_AMOUNT = "tax_amount";
    static final String TOTAL_AMOUNT = "total_amount";
    static final String DISCOUNT_APPLIED = "discount_applied";
    static final String REFUND_AMOUNT = "refund_amount";
    static final String RETRIES = "retries";
    static final String GATEWAY_FEE = "gateway_fee";
    static final String ROUNDING_DIFF = "rounding_diff";
    static final String INVOICE_DATE = "invoice_date";
    static final String PAYMENT_DATE = "payment_date";

    private static final double TOTAL_MISMATCH_WEIGHT = 0.9;
    private static final double TAX_RATE_WEIGHT = 0.6;
    private static final double REFUND_RATE_WEIGHT = 0.7;
    private static final double GATEWAY_FEE_WEIGHT = 0.5;
    private static final double RETRIES_WEIGHT = 0.5;
    private static final double ROUNDING_WEIGHT = 0.4;
    private static final double PAYMENT_DELAY_WEIGHT = 0.5;

    // within-limit checks pull the score down by at most this share of their weight
    private static final double NORMAL_PULL = 0.1;

    private static final long MILLIS_PER_DAY = 86_400_000L;

    private final InferenceConfig.Heuristic limits;

    public HeuristicInferenceAdapter(InferenceConfig config) {
        this.limits = config.getHeuristic();
        log.info("Heuristic inference adapter active: maxTaxRate={}, maxRefundRate={}, maxRetries={}",
                limits.getMaxTaxRate(), limits.getMaxRefundRate(), limits.getMaxRetries());
    }

    @Override
    public ScoreResult score(Map<String, Object> row) {
        List<Check> checks = evaluate(row);
        double normal = 1.0;
        for (Check check : checks) {
            normal *= 1.0 - check.weight() * check.excess();
        }
        double score = clamp(1.0 - normal);
        return new ScoreResult(score, labelFor(score));
    }

    @Override
    public Map<String, Double> explain(Map<String, Object> row) {
        Map<String, Double> contributions = new LinkedHashMap<>();
        for (String column : row.keySet()) {
            contributions.put(column, 0.0);
        }
        for (Check check : evaluate(row)) {
            contributions.merge(check.feature(), check.contribution(), Double::sum);
        }
        return contributions;
    }

    @Override
    public String name() {
        return "heuristic";
    }

    static String labelFor(double score) {
        if (score > 0.7) return "anomaly";
        if (score >= 0.5) return "suspicious";
        return "normal";
    }

    private List<Check> evaluate(Map<String, Object> row) {
        List<Check> checks = new ArrayList<>();

        Double invoice = RowValues.number(row, INVOICE_AMOUNT);
        Double tax = RowValues.number(row, TAX_AMOUNT);
        Double total = RowValues.number(row, TOTAL_AMOUNT);
        Double discount = RowValues.number(row, DISCOUNT_APPLIED);
        Double refund = RowValues.number(row, REFUND_AMOUNT);
        Double retries = RowValues.number(row, RETRIES);
        Double fee = RowValues.number(row, GATEWAY_FEE);
        Double rounding = RowValues.number(row, ROUNDING_DIFF);

        if (invoice != null && invoice < 0) {
            throw new InvalidRowException("Column " + INVOICE_AMOUNT + " is negative: " + invoice);
        }

        if (invoice != null && tax != null && total != null) {
            double expected = invoice + tax - (discount != null ? discount : 0.0);
            double relative = Math.abs(total - expected) / Math.max(Math.abs(expected), 1.0);
            checks.add(new Check(TOTAL_AMOUNT, TOTAL_MISMATCH_WEIGHT,
                    ratio(relative, limits.getTotalMismatchTolerance())));
        }
        if (invoice != null && invoice > 0 && tax != null) {
            checks.add(new Check(TAX_AMOUNT, TAX_RATE_WEIGHT,
                    tax < 0 ? 2.0 : ratio(tax / invoice, limits.getMaxTaxRate())));
        }
        if (refund != null) {
            double base = total != null && total > 0 ? total : (invoice != null ? invoice : 0.0);
            if (base > 0) {
                checks.add(new Check(REFUND_AMOUNT, REFUND_RATE_WEIGHT,
                        ratio(Math.abs(refund) / base, limits.getMaxRefundRate())));
            }
        }
        if (invoice != null && invoice > 0 && fee != null) {
            checks.add(new Check(GATEWAY_FEE, GATEWAY_FEE_WEIGHT,
                    ratio(Math.abs(fee) / invoice, limits.getMaxGatewayFeeRate())));
        }
        if (retries != null) {
            checks.add(new Check(RETRIES, RETRIES_WEIGHT, ratio(retries, limits.getMaxRetries())));
        }
        if (rounding != null) {
            checks.add(new Check(ROUNDING_DIFF, ROUNDING_WEIGHT,
                    ratio(Math.abs(rounding), limits.getMaxRoundingDiff())));
        }

        Long invoiced = RowValues.timestamp(row, INVOICE_DATE);
        Long paid = RowValues.timestamp(row, PAYMENT_DATE);
        if (invoiced != null && paid != null) {
            double delayDays = Math.max(0, paid - invoiced) / (double) MILLIS_PER_DAY;
            checks.add(new Check(PAYMENT_DATE, PAYMENT_DELAY_WEIGHT,
                    ratio(delayDays, limits.getMaxPaymentDelayDays())));
        }
        return checks;
    }

    private static double ratio(double observed, double limit) {
        if (limit <= 0) return observed > 0 ? 2.0 : 0.0;
        return observed / limit;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * One rule outcome. {@code ratio} is observed / limit.
     */
    private record Check(String feature, double weight, double ratio) {

        double excess() {
            return clamp(ratio - 1.0);
        }

        double contribution() {
            if (ratio > 1.0) return weight * excess();
            return -NORMAL_PULL * weight * (1.0 - clamp(ratio));
        }
    }
}
