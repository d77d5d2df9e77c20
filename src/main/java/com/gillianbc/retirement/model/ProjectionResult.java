package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Optional;

@Value
@Builder
@Jacksonized
public class ProjectionResult {
    @NonNull @Singular List<ProjectionRecord> records;
    @NonNull ProjectionSummary summary;
    @NonNull ProjectionAssumptions assumptions;

    public Optional<ProjectionRecord> recordAt(int age) {
        return records.stream().filter(r -> r.getAge() == age).findFirst();
    }

    /**
     * @return the age the portfolio ran out, if it did
     */
    public Optional<Integer> depletionAge() {
        Integer years = summary.getYearsUntilDepletion();
        return years == null ? Optional.empty() : Optional.of(assumptions.getRetirementAge() + years);
    }
}
