package com.gillianbc.retirement.service;

import com.gillianbc.retirement.model.DepletionTarget;
import com.gillianbc.retirement.model.Money;
import com.gillianbc.retirement.model.ReserveConfig;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Portfolio amount a depletion target keeps back.
 */
@Component
public class ReserveCalculator {

    public BigDecimal reserveAmount(DepletionTarget target, BigDecimal portfolio) {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(portfolio, "portfolio must not be null");
        ReserveConfig reserve = target.reserveOrDerived();
        switch (reserve.getType()) {
            case PERCENTAGE:
                return Money.round(Money.percentOf(portfolio, amountOf(reserve)));
            case ABSOLUTE:
                return Money.round(amountOf(reserve));
            default:
                // Whatever the target does not plan to spend
                BigDecimal unspent = Money.HUNDRED.subtract(target.getTargetPercentageSpent());
                return Money.round(Money.nonNegative(Money.percentOf(portfolio, unspent)));
        }
    }

    private static BigDecimal amountOf(ReserveConfig reserve) {
        return Money.nonNegative(Objects.requireNonNull(reserve.getAmount(), "reserve amount must not be null"));
    }
}
