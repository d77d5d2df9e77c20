package com.gillianbc.retirement.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Advice about an unusual but valid input.
 */
@Value
public class ProjectionWarning {
    /** Input area the warning is about, e.g. "inflationRate" or "rmd". */
    @NonNull String field;
    @NonNull String message;
    @NonNull WarningSeverity severity;
}
