package com.finfact.pipeline.consistency;

import static org.assertj.core.api.Assertions.assertThat;

import com.finfact.pipeline.config.PipelineProperties;
import com.finfact.pipeline.domain.ResolutionStatus;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ConsistencyChecker")
class ConsistencyCheckerTest {

    private static final LocalDate YEAR_END = LocalDate.of(2023, 12, 31);

    private ConsistencyChecker checker;

    @BeforeEach
    void setUp() {
        checker = new ConsistencyChecker(new PipelineProperties());
    }

    private static FactValue fact(String metric, String value) {
        return fact(metric, "consolidated", "1", value, ResolutionStatus.AUTO_AGREED);
    }

    private static FactValue fact(String metric, String scope, String unit, String value, ResolutionStatus status) {
        return new FactValue(metric, scope, YEAR_END, unit, new BigDecimal(value), status);
    }

    private ConsistencyCheckResult only(List<FactValue> facts, String identity) {
        return checker.check(facts).stream()
            .filter(result -> result.name().equals(identity))
            .findFirst()
            .orElseThrow();
    }

    @Nested
    @DisplayName("cash flow identity")
    class CashFlow {

        private final List<FactValue> facts = new ArrayList<>(List.of(
            fact("net_cash_flow_operating", "600"),
            fact("net_cash_flow_investing", "-200"),
            fact("net_cash_flow_financing", "100")
        ));

        @Test
        void absentFxEffectCountsAsZero() {
            facts.add(fact("net_increase_cash", "500"));

            ConsistencyCheckResult result = only(facts, "cash_flow_sum");

            assertThat(result.passed()).isTrue();
            assertThat(result.residual()).isEqualByComparingTo("0");
            assertThat(result.lhs()).isEqualByComparingTo("500");
            assertThat(result.rhs()).isEqualByComparingTo("500");
            assertThat(result.date()).isEqualTo(YEAR_END);
        }

        @Test
        void presentFxEffectIsAdded() {
            facts.add(fact("fx_effect_on_cash", "0"));
            facts.add(fact("net_increase_cash", "500"));

            assertThat(only(facts, "cash_flow_sum").passed()).isTrue();
        }

        @Test
        void residualBeyondToleranceFails() {
            facts.add(fact("net_increase_cash", "510"));

            ConsistencyCheckResult result = only(facts, "cash_flow_sum");

            assertThat(result.passed()).isFalse();
            assertThat(result.residual()).isEqualByComparingTo("10");
        }

        @Test
        void roundingWithinAbsoluteToleranceStillPasses() {
            facts.add(fact("net_increase_cash", "500.6"));

            assertThat(only(facts, "cash_flow_sum").passed()).isTrue();
        }

        @Test
        void missingRequiredOperandSkipsIdentity() {
            facts.remove(0);
            facts.add(fact("net_increase_cash", "500"));

            assertThat(checker.check(facts)).noneMatch(result -> result.name().equals("cash_flow_sum"));
        }
    }

    @Nested
    @DisplayName("balance sheet identities")
    class Balance {

        @Test
        void valuesAreComparedInBaseUnits() {
            List<FactValue> facts = List.of(
                fact("total_assets", "consolidated", "10k", "100", ResolutionStatus.AUTO_AGREED),
                fact("total_liabilities", "consolidated", "1", "600000", ResolutionStatus.AUTO_AGREED),
                fact("total_equity", "consolidated", "1k", "400", ResolutionStatus.AUTO_SINGLE_ENGINE)
            );

            ConsistencyCheckResult result = only(facts, "assets_eq_liabilities_plus_equity");

            assertThat(result.passed()).isTrue();
            assertThat(result.lhs()).isEqualByComparingTo("1000000");
        }

        @Test
        void parentEquityStandsInForTotalEquity() {
            List<FactValue> facts = List.of(
                fact("total_assets", "1000"),
                fact("total_liabilities", "600"),
                fact("total_equity_parent", "400")
            );

            assertThat(only(facts, "assets_eq_liabilities_plus_equity").passed()).isTrue();
        }

        @Test
        void verifiedFactWinsOverAutomaticOneForSameMetric() {
            List<FactValue> facts = List.of(
                fact("total_assets", "consolidated", "1", "999", ResolutionStatus.AUTO_AGREED),
                fact("total_assets", "consolidated", "1", "1000", ResolutionStatus.VERIFIED),
                fact("total_liabilities_equity", "1000")
            );

            ConsistencyCheckResult result = only(facts, "assets_eq_liabilities_and_equity_total");

            assertThat(result.lhs()).isEqualByComparingTo("1000");
            assertThat(result.residual()).isEqualByComparingTo("0");
        }

        @Test
        void unresolvedAndPercentFactsDoNotTakePart() {
            List<FactValue> facts = List.of(
                fact("total_assets", "consolidated", "1", "1000", ResolutionStatus.UNRESOLVED),
                fact("total_liabilities_equity", "consolidated", "percent", "100", ResolutionStatus.AUTO_AGREED),
                fact("total_liabilities", "600")
            );

            assertThat(checker.check(facts)).isEmpty();
        }
    }

    @Test
    void eachScopeIsCheckedSeparately() {
        List<FactValue> facts = List.of(
            fact("total_assets", "parent", "1", "50", ResolutionStatus.AUTO_AGREED),
            fact("total_liabilities_equity", "parent", "1", "50", ResolutionStatus.AUTO_AGREED),
            fact("total_assets", "consolidated", "1", "90", ResolutionStatus.AUTO_AGREED),
            fact("total_liabilities_equity", "consolidated", "1", "80", ResolutionStatus.AUTO_AGREED)
        );

        List<ConsistencyCheckResult> results = checker.check(facts);

        assertThat(results).extracting(ConsistencyCheckResult::scope).containsExactly("consolidated", "parent");
        assertThat(results).extracting(ConsistencyCheckResult::passed).containsExactly(false, true);
    }
}
