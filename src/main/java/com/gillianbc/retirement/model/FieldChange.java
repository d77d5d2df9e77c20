package com.gillianbc.retirement.model;

import lombok.NonNull;
import lombok.Value;

/**
 * One changed input field, with both sides rendered as canonical JSON.
 */
@Value
public class FieldChange {
    @NonNull String field;
    @NonNull String previousValue;
    @NonNull String currentValue;
}
