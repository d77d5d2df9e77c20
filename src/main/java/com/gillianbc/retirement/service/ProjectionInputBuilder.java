package com.gillianbc.retirement.service;

import com.gillianbc.retirement.config.ProjectionProperties;
import com.gillianbc.retirement.model.AccountType;
import com.gillianbc.retirement.model.BalanceByType;
import com.gillianbc.retirement.model.DebtItem;
import com.gillianbc.retirement.model.DepletionTarget;
import com.gillianbc.retirement.model.FinancialSnapshot;
import com.gillianbc.retirement.model.IncomeStream;
import com.gillianbc.retirement.model.IncomeStreamType;
import com.gillianbc.retirement.model.InvestmentAccount;
import com.gillianbc.retirement.model.Money;
import com.gillianbc.retirement.model.ProjectionInput;
import com.gillianbc.retirement.model.ProjectionOverrides;
import com.gillianbc.retirement.model.RmdConfig;
import com.gillianbc.retirement.model.SpendingPhaseConfig;
import com.gillianbc.retirement.model.TaxCategory;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a stored {@link FinancialSnapshot} plus caller overrides into a {@link ProjectionInput}.
 * <p>
 * Anything set on the overrides wins; everything else comes from the snapshot or from
 * {@link ProjectionProperties}.
 */
@Slf4j
@Service
public class ProjectionInputBuilder {

    static final int DEFAULT_SOCIAL_SECURITY_AGE = 67;
    static final String AUTO_SOCIAL_SECURITY_ID = "ss-auto";
    private static final BigDecimal SSA_MAX_MONTHLY_BENEFIT = BigDecimal.valueOf(4500);
    private static final BigDecimal DEFAULT_DEBT_RATE = BigDecimal.valueOf(5);
    /** Derived spending never exceeds this share of income. */
    private static final BigDecimal MAX_SPENDING_SHARE = new BigDecimal("0.80");

    private final ProjectionProperties properties;
    private final ReserveCalculator reserveCalculator;
    private final Validator validator;
    private final Clock clock;

    public ProjectionInputBuilder() {
        this(ProjectionProperties.defaults(), new ReserveCalculator(),
                Validation.buildDefaultValidatorFactory().getValidator(), Clock.systemUTC());
    }

    @Autowired
    public ProjectionInputBuilder(ProjectionProperties properties,
                                  ReserveCalculator reserveCalculator,
                                  Validator validator,
                                  Clock clock) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.reserveCalculator = Objects.requireNonNull(reserveCalculator, "reserveCalculator must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @throws ProjectionValidationException when an override is out of range
     */
    public ProjectionInput buildProjectionInputFromSnapshot(FinancialSnapshot snapshot, ProjectionOverrides overrides) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        ProjectionOverrides o = overrides != null ? overrides : ProjectionOverrides.none();
        validate(o);

        int startYear = LocalDate.now(clock).getYear();
        int currentAge = startYear - snapshot.getBirthYear();
        int retirementAge = o.getRetirementAge() != null ? o.getRetirementAge() : snapshot.getTargetRetirementAge();

        BalanceByType balances = aggregateBalances(snapshot.getInvestmentAccounts());
        BigDecimal annualContribution = snapshot.getInvestmentAccounts().stream()
                .map(InvestmentAccount::getMonthlyContribution)
                .filter(Objects::nonNull)
                .map(monthly -> monthly.multiply(Money.TWELVE))
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        BigDecimal essential;
        BigDecimal discretionary;
        if (snapshot.getMonthlyEssentialSpending() != null || snapshot.getMonthlyDiscretionarySpending() != null) {
            essential = orZero(snapshot.getMonthlyEssentialSpending()).multiply(Money.TWELVE);
            discretionary = orZero(snapshot.getMonthlyDiscretionarySpending()).multiply(Money.TWELVE);
        } else {
            // No breakdown, so everything counts as essential
            essential = deriveAnnualExpenses(snapshot.getAnnualIncome(), snapshot.getSavingsRate());
            discretionary = BigDecimal.ZERO;
        }

        BigDecimal annualDebtPayments = estimateAnnualDebtPayments(snapshot.getDebts());
        SpendingPhaseConfig phases = o.getSpendingPhaseConfig() != null
                ? o.getSpendingPhaseConfig() : snapshot.getSpendingPhaseConfig();
        DepletionTarget target = o.getDepletionTarget() != null
                ? o.getDepletionTarget() : snapshot.getDepletionTarget();
        BigDecimal reserveFloor = target != null && target.isEnabled()
                ? reserveCalculator.reserveAmount(target, balances.total())
                : null;

        ProjectionInput input = ProjectionInput.builder()
                .currentAge(currentAge)
                .retirementAge(retirementAge)
                .maxAge(o.getMaxAge() != null ? o.getMaxAge() : properties.maxAge())
                .startYear(startYear)
                .balancesByType(balances)
                .annualContribution(Money.round(annualContribution))
                .contributionAllocation(o.getContributionAllocation() != null
                        ? o.getContributionAllocation() : properties.contributionAllocation())
                .expectedReturn(o.getExpectedReturn() != null
                        ? o.getExpectedReturn() : properties.returnFor(snapshot.getRiskTolerance()))
                .inflationRate(o.getInflationRate() != null ? o.getInflationRate() : properties.inflationRate())
                .contributionGrowthRate(o.getContributionGrowthRate() != null
                        ? o.getContributionGrowthRate() : properties.contributionGrowthRate())
                .annualEssentialExpenses(Money.round(essential))
                .annualDiscretionaryExpenses(Money.round(discretionary))
                .annualHealthcareCosts(o.getAnnualHealthcareCosts() != null
                        ? o.getAnnualHealthcareCosts() : properties.healthcareCostAt(retirementAge))
                .healthcareInflationRate(o.getHealthcareInflationRate() != null
                        ? o.getHealthcareInflationRate() : properties.healthcareInflationRate())
                .incomeStreams(incomeStreams(snapshot, o))
                .annualDebtPayments(annualDebtPayments)
                .debtPayoffAge(annualDebtPayments.signum() > 0 ? currentAge + properties.debtPayoffYears() : null)
                .spendingPhaseConfig(phases)
                .depletionTarget(target)
                .reserveFloor(reserveFloor)
                .rmdConfig(RmdConfig.builder().startAge(properties.rmdStartAge()).build())
                .build();

        log.debug("Built projection input for age {} retiring at {} with {} income streams",
                currentAge, retirementAge, input.getIncomeStreams().size());
        return input;
    }

    private void validate(ProjectionOverrides overrides) {
        Set<ConstraintViolation<ProjectionOverrides>> violations = validator.validate(overrides);
        if (!violations.isEmpty()) {
            List<String> messages = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.toList());
            throw new ProjectionValidationException(messages);
        }
    }

    static BalanceByType aggregateBalances(List<InvestmentAccount> accounts) {
        BalanceByType balances = BalanceByType.zero();
        for (InvestmentAccount account : accounts) {
            AccountType type = account.getType() != null ? account.getType() : AccountType.OTHER;
            TaxCategory category = type.getTaxCategory();
            balances = balances.with(category, balances.get(category).add(account.getBalance()));
        }
        return balances;
    }

    /**
     * Spending implied by income and savings rate (a percentage), capped at 80% of income.
     */
    static BigDecimal deriveAnnualExpenses(BigDecimal annualIncome, BigDecimal savingsRate) {
        BigDecimal spending = annualIncome.multiply(
                BigDecimal.ONE.subtract(savingsRate.divide(Money.HUNDRED, Money.MATH_CONTEXT)));
        return spending.min(annualIncome.multiply(MAX_SPENDING_SHARE));
    }

    /**
     * Level annual payments that clear every debt over the configured payoff period.
     */
    BigDecimal estimateAnnualDebtPayments(List<DebtItem> debts) {
        int months = properties.debtPayoffYears() * 12;
        BigDecimal total = BigDecimal.ZERO;
        for (DebtItem debt : debts) {
            BigDecimal rate = debt.getInterestRate() != null ? debt.getInterestRate() : DEFAULT_DEBT_RATE;
            if (rate.signum() == 0) {
                total = total.add(debt.getBalance().divide(
                        BigDecimal.valueOf(properties.debtPayoffYears()), Money.MATH_CONTEXT));
                continue;
            }
            BigDecimal monthlyRate = rate.divide(Money.HUNDRED, Money.MATH_CONTEXT).divide(Money.TWELVE, Money.MATH_CONTEXT);
            BigDecimal factor = Money.growthFactor(monthlyRate, months);
            BigDecimal monthlyPayment = debt.getBalance()
                    .multiply(monthlyRate.multiply(factor, Money.MATH_CONTEXT), Money.MATH_CONTEXT)
                    .divide(factor.subtract(BigDecimal.ONE), Money.MATH_CONTEXT);
            total = total.add(monthlyPayment.multiply(Money.TWELVE));
        }
        return Money.round(total);
    }

    /**
     * Simplified Social Security estimate: tiered replacement of income, less 20%, capped at the
     * SSA maximum benefit.
     */
    static BigDecimal estimateSocialSecurityMonthly(BigDecimal annualIncome) {
        BigDecimal firstTier = BigDecimal.valueOf(30_000);
        BigDecimal secondTier = BigDecimal.valueOf(80_000);
        BigDecimal annualBenefit;
        if (annualIncome.compareTo(firstTier) <= 0) {
            annualBenefit = annualIncome.multiply(new BigDecimal("0.55"));
        } else if (annualIncome.compareTo(secondTier) <= 0) {
            annualBenefit = firstTier.multiply(new BigDecimal("0.55"))
                    .add(annualIncome.subtract(firstTier).multiply(new BigDecimal("0.40")));
        } else {
            annualBenefit = firstTier.multiply(new BigDecimal("0.55"))
                    .add(secondTier.subtract(firstTier).multiply(new BigDecimal("0.40")))
                    .add(annualIncome.subtract(secondTier).multiply(new BigDecimal("0.30")));
        }
        BigDecimal monthly = annualBenefit.multiply(new BigDecimal("0.80")).divide(Money.TWELVE, Money.MATH_CONTEXT);
        return Money.round(monthly.min(SSA_MAX_MONTHLY_BENEFIT));
    }

    /**
     * Override streams, else snapshot streams, else a Social Security stream from the legacy
     * claiming-age and benefit fields.
     */
    private static List<IncomeStream> incomeStreams(FinancialSnapshot snapshot, ProjectionOverrides overrides) {
        if (overrides.getIncomeStreams() != null && !overrides.getIncomeStreams().isEmpty()) {
            return overrides.getIncomeStreams();
        }
        if (!snapshot.getIncomeStreams().isEmpty()) {
            return snapshot.getIncomeStreams();
        }
        int claimingAge = overrides.getSocialSecurityAge() != null
                ? overrides.getSocialSecurityAge() : DEFAULT_SOCIAL_SECURITY_AGE;
        BigDecimal monthly = overrides.getSocialSecurityMonthly() != null
                ? overrides.getSocialSecurityMonthly() : estimateSocialSecurityMonthly(snapshot.getAnnualIncome());
        if (monthly.signum() <= 0) {
            return List.of();
        }
        return List.of(IncomeStream.builder()
                .id(AUTO_SOCIAL_SECURITY_ID)
                .name("Social Security")
                .type(IncomeStreamType.SOCIAL_SECURITY)
                .annualAmount(Money.round(monthly.multiply(Money.TWELVE)))
                .startAge(claimingAge)
                .inflationAdjusted(true)
                .build());
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
