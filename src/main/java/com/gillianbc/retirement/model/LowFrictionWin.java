package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A small change with an outsized effect on the outcome.
 */
@Value
@Builder
public class LowFrictionWin {
    @NonNull String id;
    @NonNull String title;
    @NonNull String description;
    @NonNull EffortLevel effortLevel;
    @NonNull BigDecimal potentialImpact;
    @NonNull String impactDescription;
    @NonNull String uncertaintyCaveat;
    /** Input field the win adjusts, e.g. "retirementAge". */
    @NonNull String lever;
    @NonNull BigDecimal delta;
}
