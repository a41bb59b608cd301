package com.optioncalc.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * Either a complete {@link OptionAnalysis} or the reason there is none.
 */
@Data
@Builder
public class AnalysisOutcome {

    private boolean success;
    private OptionAnalysis analysis;
    private CalculationFailure failure;

    public static AnalysisOutcome success(OptionAnalysis analysis) {
        return AnalysisOutcome.builder().success(true).analysis(analysis).build();
    }

    public static AnalysisOutcome failed(CalculationFailure failure) {
        return AnalysisOutcome.builder().success(false).failure(failure).build();
    }
}
