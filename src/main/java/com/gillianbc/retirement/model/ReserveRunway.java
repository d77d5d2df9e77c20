package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class ReserveRunway {
    @NonNull BigDecimal reserveAmount;
    /** Essential expenses left after guaranteed income. */
    @NonNull BigDecimal essentialGap;
    @NonNull RunwayYears yearsOfEssentials;
    @NonNull RunwayYears yearsOfFullSpending;
    @NonNull String description;
}
