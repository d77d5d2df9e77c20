package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class StalenessResult {
    boolean stale;
    /** Field names in {@link ProjectionInput} declaration order. */
    @NonNull @Singular List<String> changedFields;
    @NonNull @Singular List<FieldChange> changes;
}
