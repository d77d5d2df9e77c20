package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Required minimum distribution settings: SECURE 2.0 puts the trigger age at 73.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RmdConfig {

    public static final int DEFAULT_START_AGE = 73;

    @Builder.Default boolean enabled = true;
    @Builder.Default int startAge = DEFAULT_START_AGE;

    public static RmdConfig defaults() {
        return RmdConfig.builder().build();
    }

    public boolean appliesAt(int age) {
        return enabled && age >= startAge;
    }
}
