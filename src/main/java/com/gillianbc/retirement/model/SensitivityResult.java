package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class SensitivityResult {
    @NonNull BigDecimal baselineBalance;
    Integer baselineDepletion;
    /** The three levers with the largest absolute impact. */
    @NonNull @Singular List<LeverImpact> topLevers;
    /** Every lever that could be measured, ranked. */
    @NonNull @Singular("lever") List<LeverImpact> allLevers;
}
