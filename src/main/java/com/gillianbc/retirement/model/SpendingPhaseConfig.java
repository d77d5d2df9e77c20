package com.gillianbc.retirement.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class SpendingPhaseConfig {

    public static final int MAX_PHASES = 4;

    boolean enabled;
    @NonNull @Singular List<SpendingPhase> phases;

    /**
     * @return true when phases should drive spending
     */
    @JsonIgnore
    public boolean isActive() {
        return enabled && !phases.isEmpty();
    }

    /**
     * Phases in ascending start-age order, whatever order they were supplied in.
     */
    public List<SpendingPhase> sortedPhases() {
        List<SpendingPhase> sorted = new ArrayList<>(phases);
        sorted.sort(Comparator.comparingInt(SpendingPhase::getStartAge));
        return sorted;
    }
}
