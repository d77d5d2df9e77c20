package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class SensitiveAssumption {
    @NonNull Lever assumption;
    @NonNull String displayName;
    @NonNull BigDecimal currentValue;
    @NonNull String formattedValue;
    /** 0..100, relative to the most influential lever. */
    int sensitivityScore;
    @NonNull String explanation;
    @NonNull String reviewSuggestion;
}
