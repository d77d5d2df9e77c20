package com.gillianbc.retirement.service;

import com.gillianbc.retirement.model.BalanceByType;
import com.gillianbc.retirement.model.Money;
import com.gillianbc.retirement.model.TaxCategory;
import com.gillianbc.retirement.model.WithdrawalResult;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * Takes any required minimum from tax-deferred funds first, then drains categories one at a time
 * in a fixed order.
 */
public class OrderedWithdrawalPolicy implements WithdrawalPolicy {

    /** Taxable first, tax-free last to preserve tax-free growth longest. */
    public static final List<TaxCategory> DEFAULT_ORDER =
            List.of(TaxCategory.TAXABLE, TaxCategory.TAX_DEFERRED, TaxCategory.TAX_FREE);

    private final List<TaxCategory> order;

    public OrderedWithdrawalPolicy(List<TaxCategory> order) {
        Objects.requireNonNull(order, "order must not be null");
        if (order.size() != TaxCategory.values().length || !EnumSet.copyOf(order).equals(EnumSet.allOf(TaxCategory.class))) {
            throw new IllegalArgumentException("order must list each tax category exactly once");
        }
        this.order = List.copyOf(order);
    }

    public static OrderedWithdrawalPolicy defaultOrder() {
        return new OrderedWithdrawalPolicy(DEFAULT_ORDER);
    }

    public List<TaxCategory> getOrder() {
        return order;
    }

    @Override
    public WithdrawalResult withdraw(BigDecimal need, BalanceByType balances, BigDecimal requiredMinimum) {
        Objects.requireNonNull(need, "need must not be null");
        Objects.requireNonNull(balances, "balances must not be null");
        Objects.requireNonNull(requiredMinimum, "requiredMinimum must not be null");

        BigDecimal rmdRequired = Money.nonNegative(requiredMinimum);
        BigDecimal rmdTaken = rmdRequired.min(Money.nonNegative(balances.getTaxDeferred()));
        BalanceByType taken = BalanceByType.zero().with(TaxCategory.TAX_DEFERRED, rmdTaken);

        BigDecimal remaining = Money.nonNegative(need).subtract(rmdTaken);
        BigDecimal reinvested = BigDecimal.ZERO;
        if (remaining.signum() < 0) {
            reinvested = remaining.negate();
            remaining = BigDecimal.ZERO;
        }

        for (TaxCategory category : order) {
            if (remaining.signum() <= 0) {
                break;
            }
            BigDecimal available = Money.nonNegative(balances.get(category).subtract(taken.get(category)));
            BigDecimal draw = remaining.min(available);
            if (draw.signum() > 0) {
                taken = taken.with(category, taken.get(category).add(draw));
                remaining = remaining.subtract(draw);
            }
        }

        return WithdrawalResult.builder()
                .withdrawals(taken)
                .rmdRequired(rmdRequired)
                .rmdTaken(rmdTaken)
                .rmdReinvested(reinvested)
                .shortfall(remaining)
                .build();
    }
}
