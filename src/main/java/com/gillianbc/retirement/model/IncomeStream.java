package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A named source of retirement income (Social Security, pension, rental, ...).
 * <p>
 * The amount is in today's dollars at {@code startAge}. A missing {@code endAge} means lifetime income.
 */
@Getter
@ToString
@EqualsAndHashCode
public class IncomeStream {

    @NonNull private final String id;
    @NonNull private final String name;
    @NonNull private final IncomeStreamType type;
    @NonNull private final BigDecimal annualAmount;
    private final int startAge;
    private final Integer endAge;
    private final boolean inflationAdjusted;
    private final boolean guaranteed;
    private final boolean spouse;

    /**
     * When {@code guaranteed} is null it is derived from the stream type.
     */
    @Builder(toBuilder = true)
    @Jacksonized
    public IncomeStream(String id,
                        String name,
                        IncomeStreamType type,
                        BigDecimal annualAmount,
                        int startAge,
                        Integer endAge,
                        boolean inflationAdjusted,
                        Boolean guaranteed,
                        boolean spouse) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.annualAmount = Objects.requireNonNull(annualAmount, "annualAmount must not be null");
        this.startAge = startAge;
        this.endAge = endAge;
        this.inflationAdjusted = inflationAdjusted;
        this.guaranteed = guaranteed != null ? guaranteed : type.isGuaranteedByDefault();
        this.spouse = spouse;
    }

    /**
     * @return true when the stream pays out at the given age
     */
    public boolean isActiveAt(int age) {
        return age >= startAge && (endAge == null || age <= endAge);
    }
}
