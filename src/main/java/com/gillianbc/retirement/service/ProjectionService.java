package com.gillianbc.retirement.service;

import com.gillianbc.retirement.model.BalanceByType;
import com.gillianbc.retirement.model.Money;
import com.gillianbc.retirement.model.PhaseAdjustedExpenses;
import com.gillianbc.retirement.model.ProjectionAssumptions;
import com.gillianbc.retirement.model.ProjectionInput;
import com.gillianbc.retirement.model.ProjectionRecord;
import com.gillianbc.retirement.model.ProjectionResult;
import com.gillianbc.retirement.model.ProjectionSummary;
import com.gillianbc.retirement.model.ReductionStage;
import com.gillianbc.retirement.model.RmdDetail;
import com.gillianbc.retirement.model.WithdrawalResult;
import com.gillianbc.retirement.reference.UniformLifetimeTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Year-by-year retirement projection.
 * <p>
 * End-of-year model: while working, {@code (balance + contribution - debt) * (1 + return)};
 * once retired, {@code (balance - withdrawal) * (1 + return)}. One record is produced for every
 * age from currentAge to maxAge inclusive.
 */
@Slf4j
@Service
public class ProjectionService {

    private final IncomeStreamResolver incomeStreamResolver;
    private final SpendingModel spendingModel;
    private final WithdrawalPolicy withdrawalPolicy;
    private final RmdCalculator rmdCalculator;
    private final ProjectionInputValidator validator;

    public ProjectionService() {
        this(new IncomeStreamResolver(), new SpendingModel(), OrderedWithdrawalPolicy.defaultOrder(),
                new RmdCalculator(new UniformLifetimeTable()), new ProjectionInputValidator());
    }

    @Autowired
    public ProjectionService(IncomeStreamResolver incomeStreamResolver,
                             SpendingModel spendingModel,
                             WithdrawalPolicy withdrawalPolicy,
                             RmdCalculator rmdCalculator,
                             ProjectionInputValidator validator) {
        this.incomeStreamResolver = Objects.requireNonNull(incomeStreamResolver, "incomeStreamResolver must not be null");
        this.spendingModel = Objects.requireNonNull(spendingModel, "spendingModel must not be null");
        this.withdrawalPolicy = Objects.requireNonNull(withdrawalPolicy, "withdrawalPolicy must not be null");
        this.rmdCalculator = Objects.requireNonNull(rmdCalculator, "rmdCalculator must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    /**
     * Runs the projection.
     *
     * @throws ProjectionValidationException when the input breaks an invariant; nothing is simulated
     */
    public ProjectionResult runProjection(ProjectionInput input) {
        Objects.requireNonNull(input, "input must not be null");
        validator.validate(input);

        BalanceByType balances = input.getBalancesByType();
        List<ProjectionRecord> records = new ArrayList<>(input.getMaxAge() - input.getCurrentAge() + 1);

        BigDecimal retirementBalance = null;
        BigDecimal totalContributions = BigDecimal.ZERO;
        BigDecimal totalWithdrawals = BigDecimal.ZERO;
        Integer yearsUntilDepletion = null;
        int yearsReserveConstrained = 0;
        Integer firstReserveConstraintAge = null;

        for (int age = input.getCurrentAge(); age <= input.getMaxAge(); age++) {
            boolean retired = age >= input.getRetirementAge();
            if (retired && retirementBalance == null) {
                // Balance entering the first retired year, before any withdrawal
                retirementBalance = balances.total();
            }

            boolean hadFunds = balances.total().signum() > 0;
            YearEnd yearEnd = retired
                    ? decumulate(input, age, balances, yearsUntilDepletion != null)
                    : accumulate(input, age, balances);
            balances = yearEnd.balances;
            ProjectionRecord record = yearEnd.record;
            records.add(record);

            if (record.getNetFlow().signum() > 0) {
                totalContributions = totalContributions.add(record.getNetFlow());
            } else {
                totalWithdrawals = totalWithdrawals.add(record.getNetFlow().negate());
            }
            if (record.isReserveConstrained()) {
                yearsReserveConstrained++;
                if (firstReserveConstraintAge == null) {
                    firstReserveConstraintAge = age;
                }
            }
            // A zero balance only counts as depletion if the year drew it down or fell short
            if (retired && yearsUntilDepletion == null && record.getBalance().signum() == 0
                    && (hadFunds || record.getSpendingShortfall().signum() > 0)) {
                yearsUntilDepletion = age - input.getRetirementAge();
            }
        }

        ProjectionSummary summary = ProjectionSummary.builder()
                .startingBalance(Money.round(input.getBalancesByType().total()))
                .projectedRetirementBalance(Money.round(retirementBalance == null ? balances.total() : retirementBalance))
                .endingBalance(records.get(records.size() - 1).getBalance())
                .totalContributions(Money.round(totalContributions))
                .totalWithdrawals(Money.round(totalWithdrawals))
                .yearsUntilDepletion(yearsUntilDepletion)
                .reserveFloor(input.getReserveFloor())
                .yearsReserveConstrained(yearsReserveConstrained)
                .firstReserveConstraintAge(firstReserveConstraintAge)
                .build();

        log.debug("Projected ages {}..{} ({} records), depletion after {} retired years, {} reserve-constrained years",
                input.getCurrentAge(), input.getMaxAge(), records.size(), yearsUntilDepletion, yearsReserveConstrained);

        return ProjectionResult.builder()
                .records(records)
                .summary(summary)
                .assumptions(ProjectionAssumptions.from(input))
                .build();
    }

    private YearEnd accumulate(ProjectionInput input, int age, BalanceByType start) {
        BigDecimal grownContribution = input.getAnnualContribution().multiply(
                Money.growthFactor(input.getContributionGrowthRate(), age - input.getCurrentAge()), Money.MATH_CONTEXT);
        BigDecimal debtPayments = input.debtPaymentsAt(age);
        BigDecimal contribution = Money.nonNegative(grownContribution.subtract(debtPayments));

        BalanceByType balances = start.plus(input.getContributionAllocation().allocate(contribution));

        // Still working past the RMD age: the distribution leaves the account and is saved as taxable
        Optional<BigDecimal> period = rmdCalculator.distributionPeriod(input.getRmdConfig(), age);
        BigDecimal required = period
                .map(p -> rmdCalculator.requiredMinimum(start.getTaxDeferred(), p))
                .orElse(BigDecimal.ZERO);
        WithdrawalResult withdrawal = withdrawalPolicy.withdraw(BigDecimal.ZERO, balances, required);
        balances = balances.minusClamped(withdrawal.getWithdrawals()).addTaxable(withdrawal.getRmdReinvested());

        balances = balances.grow(input.getExpectedReturn());

        ProjectionRecord record = baseRecord(input, age, balances, withdrawal, period)
                .inflows(Money.round(contribution))
                .outflows(Money.ZERO)
                .contributions(Money.round(contribution))
                .income(Money.ZERO)
                .withdrawals(Money.ZERO)
                .essentialExpenses(Money.ZERO)
                .discretionaryExpenses(Money.ZERO)
                .healthcareExpenses(Money.ZERO)
                .debtPayments(Money.round(debtPayments))
                .retired(false)
                .spendingShortfall(Money.ZERO)
                .netFlow(Money.round(contribution))
                .build();
        return new YearEnd(balances, record);
    }

    private YearEnd decumulate(ProjectionInput input, int age, BalanceByType start, boolean depleted) {
        PhaseAdjustedExpenses planned = spendingModel.expensesAt(input, age);
        BigDecimal inflation = spendingModel.inflationFactor(input, age);
        BigDecimal essential = planned.getEssential().multiply(inflation, Money.MATH_CONTEXT);
        BigDecimal discretionary = planned.getDiscretionary().multiply(inflation, Money.MATH_CONTEXT);
        BigDecimal healthcare = spendingModel.healthcareCostsAt(input, age);
        BigDecimal debtPayments = input.debtPaymentsAt(age);
        BigDecimal income = incomeStreamResolver.totalIncomeAt(input, age);

        BigDecimal expenses = essential.add(discretionary).add(healthcare).add(debtPayments);
        BigDecimal need = expenses.subtract(income);

        BalanceByType balances;
        WithdrawalResult withdrawal;
        Optional<BigDecimal> period = Optional.empty();
        BigDecimal shortfall = BigDecimal.ZERO;
        BigDecimal netFlow;
        boolean constrained = false;
        ReductionStage stage = ReductionStage.NONE;

        if (depleted) {
            // Nothing left to draw on and nothing is reinvested any more; any RMD is zero
            balances = BalanceByType.zero();
            period = rmdCalculator.distributionPeriod(input.getRmdConfig(), age);
            withdrawal = withdrawalPolicy.withdraw(BigDecimal.ZERO, balances, BigDecimal.ZERO);
            shortfall = Money.nonNegative(need);
            netFlow = BigDecimal.ZERO;
        } else {
            period = rmdCalculator.distributionPeriod(input.getRmdConfig(), age);
            BigDecimal required = period
                    .map(p -> rmdCalculator.requiredMinimum(start.getTaxDeferred(), p))
                    .orElse(BigDecimal.ZERO);

            if (need.signum() <= 0) {
                BigDecimal surplus = need.negate();
                withdrawal = withdrawalPolicy.withdraw(BigDecimal.ZERO, start, required);
                balances = start.minusClamped(withdrawal.getWithdrawals())
                        .addTaxable(withdrawal.getRmdReinvested())
                        .addTaxable(surplus);
                netFlow = surplus;
            } else {
                BigDecimal fundable = need;
                if (input.getReserveFloor() != null) {
                    BigDecimal available = Money.nonNegative(start.total().subtract(input.getReserveFloor()));
                    if (need.compareTo(available) > 0) {
                        BigDecimal cut = need.subtract(available);
                        constrained = true;
                        stage = reductionStage(cut, discretionary);
                        shortfall = cut;
                        fundable = available;
                    }
                }
                withdrawal = withdrawalPolicy.withdraw(fundable, start, required);
                shortfall = shortfall.add(withdrawal.getShortfall());
                balances = start.minusClamped(withdrawal.getWithdrawals()).addTaxable(withdrawal.getRmdReinvested());
                netFlow = withdrawal.spent().negate();
            }
            balances = balances.grow(input.getExpectedReturn());
        }

        BigDecimal endBalance = Money.round(balances.total());
        BigDecimal reserveBalance = input.getReserveFloor() == null
                ? null
                : Money.round(Money.nonNegative(endBalance.subtract(input.getReserveFloor())));

        ProjectionRecord record = baseRecord(input, age, balances, withdrawal, period)
                .inflows(Money.round(income))
                .outflows(Money.round(Money.nonNegative(expenses.subtract(shortfall))))
                .contributions(Money.ZERO)
                .income(Money.round(income))
                .withdrawals(Money.round(withdrawal.spent()))
                .essentialExpenses(Money.round(essential))
                .discretionaryExpenses(Money.round(discretionary))
                .healthcareExpenses(Money.round(healthcare))
                .debtPayments(Money.round(debtPayments))
                .activePhaseName(planned.getPhaseName())
                .retired(true)
                .reserveConstrained(constrained)
                .reductionStage(stage)
                .spendingShortfall(Money.round(shortfall))
                .reserveBalance(reserveBalance)
                .netFlow(Money.round(netFlow))
                .build();
        return new YearEnd(balances, record);
    }

    /**
     * Discretionary spending is cut first; essentials only once it is gone.
     */
    private static ReductionStage reductionStage(BigDecimal cut, BigDecimal discretionary) {
        int compared = cut.compareTo(discretionary);
        if (compared < 0) {
            return ReductionStage.DISCRETIONARY_REDUCED;
        }
        if (compared == 0) {
            return ReductionStage.ESSENTIALS_ONLY;
        }
        return ReductionStage.ESSENTIALS_REDUCED;
    }

    private static ProjectionRecord.ProjectionRecordBuilder baseRecord(ProjectionInput input, int age,
                                                                       BalanceByType balances,
                                                                       WithdrawalResult withdrawal,
                                                                       Optional<BigDecimal> period) {
        BalanceByType rounded = balances.rounded();
        RmdDetail rmd = period
                .map(p -> RmdDetail.builder()
                        .required(Money.round(withdrawal.getRmdRequired()))
                        .taken(Money.round(withdrawal.getRmdTaken()))
                        .distributionPeriod(p)
                        .build())
                .orElse(null);
        return ProjectionRecord.builder()
                .age(age)
                .year(input.getStartYear() + (age - input.getCurrentAge()))
                .balance(rounded.total())
                .balanceByType(rounded)
                .withdrawalsByType(withdrawal.getWithdrawals().rounded())
                .rmd(rmd);
    }

    private static final class YearEnd {
        private final BalanceByType balances;
        private final ProjectionRecord record;

        private YearEnd(BalanceByType balances, ProjectionRecord record) {
            this.balances = balances;
            this.record = record;
        }
    }
}
