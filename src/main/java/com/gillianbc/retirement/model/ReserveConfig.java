package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;

/**
 * Reserve protection policy. {@code amount} is a percentage for {@link ReserveType#PERCENTAGE},
 * dollars for {@link ReserveType#ABSOLUTE} and ignored for {@link ReserveType#DERIVED}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ReserveConfig {
    @NonNull @Builder.Default ReserveType type = ReserveType.DERIVED;
    BigDecimal amount;
    @NonNull @Singular List<ReservePurpose> purposes;

    public static ReserveConfig derived() {
        return ReserveConfig.builder().build();
    }
}
