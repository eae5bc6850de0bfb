package com.finfact.pipeline.taxonomy;

import static org.assertj.core.api.Assertions.assertThat;

import com.finfact.pipeline.config.PipelineProperties;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("MetricMatcher")
class MetricMatcherTest {

    private static MetricDictionary dictionary;

    private MetricMatcher matcher;

    @BeforeAll
    static void loadDictionary() {
        dictionary = TaxonomyFixtures.standard();
    }

    @BeforeEach
    void setUp() {
        matcher = new MetricMatcher(new PipelineProperties());
    }

    private MatchResult match(String label) {
        return matcher.match(dictionary, MatchRequest.of(label, null));
    }

    @Nested
    @DisplayName("exact matches")
    class Exact {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = '|', value = {
            "货币资金                         | monetary_funds",
            "其中：存货                        | inventory",
            "一、营业总收入                    | revenue",
            "营业收入（附注五、30）             | revenue",
            "加：期初现金及现金等价物余额        | cash_begin",
            "归属于母公司所有者权益合计          | total_equity_parent",
            "Total assets                    | total_assets",
            "毛利率                           | gross_margin"
        })
        void resolvesCanonicalCode(String label, String code) {
            MatchResult result = match(label);

            assertThat(result.isMatched()).isTrue();
            assertThat(result.metricCode()).isEqualTo(code);
            assertThat(result.method()).isEqualTo(MatchMethod.EXACT);
        }
    }

    @Nested
    @DisplayName("affix matches")
    class Affix {

        @Test
        void toleratesShortResidue() {
            MatchResult result = match("经营活动产生的现金流量净额合计");

            assertThat(result.metricCode()).isEqualTo("net_cash_flow_operating");
            assertThat(result.method()).isEqualTo(MatchMethod.AFFIX);
            assertThat(result.statementType()).isEqualTo(StatementType.CASH_FLOW);
        }

        @Test
        void rejectsLongResidue() {
            assertThat(match("经营活动产生的现金流量净额调整项目明细表").isMatched()).isFalse();
        }

        @Test
        void neverMatchesInsideLongerLabel() {
            MatchResult result = match("其他业务收入占营业收入比重");

            assertThat(result.isMatched()).isFalse();
            assertThat(result.method()).isEqualTo(MatchMethod.NONE);
        }
    }

    @Nested
    @DisplayName("guards")
    class Guards {

        @ParameterizedTest
        @ValueSource(strings = {"合计", "小计", "项目", "期末余额", "Total", "人民币"})
        void stopLabelsNeverMatch(String label) {
            MatchResult result = match(label);

            assertThat(result.isMatched()).isFalse();
            assertThat(MetricMatcher.isRawCode(result.metricCode())).isTrue();
        }

        @Test
        void shortCanonicalNameOnlyMatchesExactly() {
            assertThat(match("存货").metricCode()).isEqualTo("inventory");
            assertThat(match("存货跌价准备").isMatched()).isFalse();
        }

        @Test
        void ratioLabelCannotResolveToMonetaryMetric() {
            assertThat(match("营业收入增长率").isMatched()).isFalse();
            assertThat(match("销售毛利率%").metricCode()).isEqualTo("gross_margin");
        }
    }

    @Nested
    @DisplayName("statement routing")
    class Routing {

        private MetricDictionary ambiguous;

        @BeforeEach
        void buildAmbiguousDictionary() {
            ambiguous = TaxonomyFixtures.fromJson("""
                {
                  "version": "routing-test",
                  "backgroundRules": {"230000": "cashflow"},
                  "metrics": [
                    {"metric_code": "interest_income", "metric_name_cn": "利息收入",
                     "statement_type": "income", "value_nature": "flow"},
                    {"metric_code": "interest_received", "metric_name_cn": "收取利息",
                     "statement_type": "cashflow", "value_nature": "flow", "patterns": ["利息收入"]}
                  ]
                }
                """);
        }

        @Test
        void tableTypeIsTriedFirst() {
            assertThat(matcher.match(ambiguous, MatchRequest.of("利息收入", StatementType.INCOME)).metricCode())
                .isEqualTo("interest_income");
            assertThat(matcher.match(ambiguous, MatchRequest.of("利息收入", StatementType.CASH_FLOW)).metricCode())
                .isEqualTo("interest_received");
        }

        @Test
        void backgroundRuleRestrictsCandidates() {
            MatchResult result = matcher.match(ambiguous, new MatchRequest("利息收入", StatementType.INCOME, "230000"));

            assertThat(result.metricCode()).isEqualTo("interest_received");
            assertThat(result.statementType()).isEqualTo(StatementType.CASH_FLOW);
        }
    }

    @Test
    void rawCodeIsStablePerLabelAndStatement() {
        String first = MetricMatcher.rawCode("研发投入", StatementType.INCOME);

        assertThat(first).startsWith("raw_").hasSize(16);
        assertThat(MetricMatcher.rawCode("研发投入", StatementType.INCOME)).isEqualTo(first);
        assertThat(MetricMatcher.rawCode("研发投入", StatementType.BALANCE)).isNotEqualTo(first);
        assertThat(match("研发投入").metricCode()).isEqualTo(MetricMatcher.rawCode("研发投入", null));
    }
}
