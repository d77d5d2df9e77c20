package com.gillianbc.retirement.service;

import com.gillianbc.retirement.model.BalanceByType;
import com.gillianbc.retirement.model.TaxCategory;
import com.gillianbc.retirement.model.WithdrawalResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OrderedWithdrawalPolicyTest {

    private final OrderedWithdrawalPolicy policy = OrderedWithdrawalPolicy.defaultOrder();

    @Test
    @DisplayName("Need is met from taxable before tax-deferred before tax-free")
    void withdraw_followsDefaultOrder() {
        WithdrawalResult result = policy.withdraw(new BigDecimal("150"),
                BalanceByType.of("100", "100", "30"), BigDecimal.ZERO);

        assertEquals(0, result.getWithdrawals().getTaxable().compareTo(new BigDecimal("30")));
        assertEquals(0, result.getWithdrawals().getTaxDeferred().compareTo(new BigDecimal("100")));
        assertEquals(0, result.getWithdrawals().getTaxFree().compareTo(new BigDecimal("20")));
        assertEquals(0, result.getShortfall().signum());
        assertEquals(0, result.spent().compareTo(new BigDecimal("150")));
    }

    @Test
    @DisplayName("Whatever the balances cannot cover is reported as a shortfall")
    void withdraw_insufficientFunds_reportsShortfall() {
        WithdrawalResult result = policy.withdraw(new BigDecimal("500"),
                BalanceByType.of("100", "100", "100"), BigDecimal.ZERO);

        assertEquals(0, result.getWithdrawals().total().compareTo(new BigDecimal("300")));
        assertEquals(0, result.getShortfall().compareTo(new BigDecimal("200")));
    }

    @Test
    @DisplayName("The RMD comes out of tax-deferred first and counts towards the need")
    void withdraw_rmdCountsTowardsNeed() {
        WithdrawalResult result = policy.withdraw(new BigDecimal("50"),
                BalanceByType.of("1000", "0", "100"), new BigDecimal("40"));

        assertEquals(0, result.getRmdTaken().compareTo(new BigDecimal("40")));
        assertEquals(0, result.getWithdrawals().getTaxDeferred().compareTo(new BigDecimal("40")));
        assertEquals(0, result.getWithdrawals().getTaxable().compareTo(new BigDecimal("10")));
        assertEquals(0, result.getRmdReinvested().signum());
    }

    @Test
    @DisplayName("An RMD larger than the need is reinvested, not spent")
    void withdraw_rmdAboveNeed_reinvestsExcess() {
        WithdrawalResult result = policy.withdraw(new BigDecimal("10"),
                BalanceByType.of("1000", "0", "100"), new BigDecimal("40"));

        assertEquals(0, result.getRmdReinvested().compareTo(new BigDecimal("30")));
        assertEquals(0, result.spent().compareTo(new BigDecimal("10")));
        assertEquals(0, result.getWithdrawals().getTaxable().signum());
    }

    @Test
    @DisplayName("The RMD cannot exceed the tax-deferred balance")
    void withdraw_rmdCappedAtBalance() {
        WithdrawalResult result = policy.withdraw(BigDecimal.ZERO,
                BalanceByType.of("25", "0", "0"), new BigDecimal("40"));

        assertEquals(0, result.getRmdRequired().compareTo(new BigDecimal("40")));
        assertEquals(0, result.getRmdTaken().compareTo(new BigDecimal("25")));
    }

    @Test
    @DisplayName("A custom order is honoured")
    void withdraw_customOrder() {
        OrderedWithdrawalPolicy taxFreeFirst = new OrderedWithdrawalPolicy(
                List.of(TaxCategory.TAX_FREE, TaxCategory.TAXABLE, TaxCategory.TAX_DEFERRED));

        WithdrawalResult result = taxFreeFirst.withdraw(new BigDecimal("50"),
                BalanceByType.of("100", "100", "100"), BigDecimal.ZERO);

        assertEquals(0, result.getWithdrawals().getTaxFree().compareTo(new BigDecimal("50")));
        assertEquals(0, result.getWithdrawals().getTaxable().signum());
    }

    @Test
    @DisplayName("An order missing a category is rejected")
    void constructor_incompleteOrder_throws() {
        assertThrows(IllegalArgumentException.class, () ->
                new OrderedWithdrawalPolicy(List.of(TaxCategory.TAXABLE, TaxCategory.TAXABLE, TaxCategory.TAX_FREE)));
        assertThrows(IllegalArgumentException.class, () ->
                new OrderedWithdrawalPolicy(List.of(TaxCategory.TAXABLE)));
    }
}
