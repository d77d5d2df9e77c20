package com.gillianbc.retirement.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Immutable amounts split across the three tax categories.
 * <p>
 * Used for balances, withdrawals and contribution allocation percentages alike.
 */
@Getter
@ToString
@EqualsAndHashCode
public class BalanceByType {

    @NonNull private final BigDecimal taxDeferred;
    @NonNull private final BigDecimal taxFree;
    @NonNull private final BigDecimal taxable;

    @JsonCreator
    public BalanceByType(@JsonProperty("taxDeferred") BigDecimal taxDeferred,
                         @JsonProperty("taxFree") BigDecimal taxFree,
                         @JsonProperty("taxable") BigDecimal taxable) {
        this.taxDeferred = Objects.requireNonNull(taxDeferred, "taxDeferred must not be null");
        this.taxFree = Objects.requireNonNull(taxFree, "taxFree must not be null");
        this.taxable = Objects.requireNonNull(taxable, "taxable must not be null");
    }

    public static BalanceByType zero() {
        return new BalanceByType(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public static BalanceByType of(String taxDeferred, String taxFree, String taxable) {
        return new BalanceByType(new BigDecimal(taxDeferred), new BigDecimal(taxFree), new BigDecimal(taxable));
    }

    /**
     * @return taxDeferred + taxFree + taxable
     */
    public BigDecimal total() {
        return taxDeferred.add(taxFree).add(taxable);
    }

    public BigDecimal get(TaxCategory category) {
        switch (category) {
            case TAX_DEFERRED:
                return taxDeferred;
            case TAX_FREE:
                return taxFree;
            default:
                return taxable;
        }
    }

    public BalanceByType with(TaxCategory category, BigDecimal amount) {
        switch (category) {
            case TAX_DEFERRED:
                return new BalanceByType(amount, taxFree, taxable);
            case TAX_FREE:
                return new BalanceByType(taxDeferred, amount, taxable);
            default:
                return new BalanceByType(taxDeferred, taxFree, amount);
        }
    }

    public BalanceByType plus(BalanceByType other) {
        return new BalanceByType(
                taxDeferred.add(other.taxDeferred),
                taxFree.add(other.taxFree),
                taxable.add(other.taxable));
    }

    /**
     * Subtracts per category, never going below zero.
     */
    public BalanceByType minusClamped(BalanceByType other) {
        return new BalanceByType(
                Money.nonNegative(taxDeferred.subtract(other.taxDeferred)),
                Money.nonNegative(taxFree.subtract(other.taxFree)),
                Money.nonNegative(taxable.subtract(other.taxable)));
    }

    public BalanceByType addTaxable(BigDecimal amount) {
        return new BalanceByType(taxDeferred, taxFree, taxable.add(amount));
    }

    /**
     * Applies one year of growth to each category independently.
     */
    public BalanceByType grow(BigDecimal rate) {
        BigDecimal factor = BigDecimal.ONE.add(rate, Money.MATH_CONTEXT);
        return new BalanceByType(
                taxDeferred.multiply(factor, Money.MATH_CONTEXT),
                taxFree.multiply(factor, Money.MATH_CONTEXT),
                taxable.multiply(factor, Money.MATH_CONTEXT));
    }

    /**
     * Splits an amount using this instance as allocation percentages (summing to 100).
     */
    public BalanceByType allocate(BigDecimal amount) {
        return new BalanceByType(
                Money.percentOf(amount, taxDeferred),
                Money.percentOf(amount, taxFree),
                Money.percentOf(amount, taxable));
    }

    public BalanceByType rounded() {
        return new BalanceByType(
                Money.round(Money.nonNegative(taxDeferred)),
                Money.round(Money.nonNegative(taxFree)),
                Money.round(Money.nonNegative(taxable)));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return taxDeferred.signum() <= 0 && taxFree.signum() <= 0 && taxable.signum() <= 0;
    }
}
