package com.gillianbc.retirement.model;

import lombok.NonNull;
import lombok.Value;

@Value
public class RetirementStatusResult {
    @NonNull RetirementStatus status;
    @NonNull String label;
    @NonNull String description;
}
