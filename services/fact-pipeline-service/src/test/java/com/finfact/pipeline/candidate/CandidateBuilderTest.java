package com.finfact.pipeline.candidate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.finfact.pipeline.artifact.RawTableCandidate;
import com.finfact.pipeline.config.PipelineProperties;
import com.finfact.pipeline.domain.FactType;
import com.finfact.pipeline.grid.LogicalGrid;
import com.finfact.pipeline.taxonomy.MetricDictionary;
import com.finfact.pipeline.taxonomy.MetricMatcher;
import com.finfact.pipeline.taxonomy.StatementType;
import com.finfact.pipeline.taxonomy.StatementTypeDetector;
import com.finfact.pipeline.taxonomy.TaxonomyFixtures;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CandidateBuilder")
class CandidateBuilderTest {

    private static final UUID VERSION_ID = UUID.randomUUID();

    private static MetricDictionary dictionary;

    private CandidateBuilder builder;

    @BeforeAll
    static void loadDictionary() {
        dictionary = TaxonomyFixtures.standard();
    }

    @BeforeEach
    void setUp() {
        PipelineProperties properties = new PipelineProperties();
        MetricMatcher matcher = new MetricMatcher(properties);
        builder = new CandidateBuilder(matcher, new StatementTypeDetector(matcher), new PeriodResolver(properties), properties);
    }

    private static RawTableCandidate table(String title, String context, List<String> labels, List<List<String>> dataRows) {
        List<List<String>> rows = new ArrayList<>();
        rows.add(labels);
        rows.addAll(dataRows);
        return new RawTableCandidate("mineru", 12, title, context, new LogicalGrid(labels, rows, 1));
    }

    private static FactCandidate find(TableCandidates result, String metricCode, String columnLabel) {
        return result.candidates().stream()
            .filter(c -> c.metricCode().equals(metricCode) && c.columnLabel().equals(columnLabel))
            .findFirst()
            .orElseThrow();
    }

    @Nested
    @DisplayName("balance sheet with dated columns")
    class DatedBalanceSheet {

        private TableCandidates result;

        @BeforeEach
        void build() {
            RawTableCandidate balance = table(
                "合并资产负债表",
                "单位：万元",
                List.of("项目", "附注", "2023年12月31日", "2022年12月31日"),
                List.of(
                    List.of("货币资金", "五、1", "1,000", "900"),
                    List.of("其中：存货", "", "300", "250"),
                    List.of("研发投入", "", "12", ""),
                    List.of("合计", "", "n/a", "")
                )
            );
            result = builder.build(dictionary, balance, new BuildContext("R1", VERSION_ID, null));
        }

        @Test
        void acceptsTableAndSkipsNoteAndBlankCells() {
            assertThat(result.accepted()).isTrue();
            assertThat(result.distinctMetrics()).isEqualTo(2);
            assertThat(result.statementType()).isEqualTo(StatementType.BALANCE);
            assertThat(result.labelledRows()).isEqualTo(4);
            assertThat(result.unmatchedRows()).isEqualTo(2);
            assertThat(result.candidates()).hasSize(6);
            assertThat(result.candidates()).noneMatch(c -> c.columnLabel().equals("附注"));
        }

        @Test
        void matchedCellCarriesUnitScopeAndPeriod() {
            FactCandidate cash = find(result, "monetary_funds", "2023年12月31日");

            assertThat(cash.matched()).isTrue();
            assertThat(cash.value()).isEqualByComparingTo(new BigDecimal("1000"));
            assertThat(cash.unit()).isEqualTo("10k");
            assertThat(cash.currency()).isEqualTo("CNY");
            assertThat(cash.scope()).isEqualTo(ConsolidationScope.CONSOLIDATED);
            assertThat(cash.period()).isEqualTo(PeriodDescriptor.stock(LocalDate.of(2023, 12, 31)));
            assertThat(cash.quality()).isEqualTo(1.0);
            assertThat(cash.versionId()).isEqualTo(VERSION_ID);
            assertThat(cash.engine()).isEqualTo("mineru");
            assertThat(cash.pageNumber()).isEqualTo(12);
        }

        @Test
        void unmatchedRowsKeepRawCodeAndUnparsableValuesScoreLow() {
            FactCandidate research = result.candidates().stream()
                .filter(c -> c.rawLabel().equals("研发投入"))
                .findFirst()
                .orElseThrow();
            FactCandidate total = result.candidates().stream()
                .filter(c -> c.rawLabel().equals("合计"))
                .findFirst()
                .orElseThrow();

            assertThat(research.matched()).isFalse();
            assertThat(MetricMatcher.isRawCode(research.metricCode())).isTrue();
            assertThat(research.quality()).isCloseTo(0.3, within(1e-9));
            assertThat(total.value()).isNull();
            assertThat(total.rawValue()).isEqualTo("n/a");
            assertThat(total.quality()).isZero();
        }
    }

    @Nested
    @DisplayName("positional income statement")
    class PositionalIncomeStatement {

        private final List<String> labels = List.of("col_0", "col_1", "col_2");
        private final List<List<String>> rows = List.of(
            List.of("一、营业总收入", "500", "400"),
            List.of("净利润", "50", "40"),
            List.of("毛利率", "35.2%", "33.0%")
        );

        @Test
        void fiscalYearAnchorsColumnPositions() {
            TableCandidates result = builder.build(dictionary, table("母公司利润表", "", labels, rows), new BuildContext("R1", VERSION_ID, 2023));

            FactCandidate current = find(result, "revenue", "col_1");
            FactCandidate prior = find(result, "revenue", "col_2");
            assertThat(current.scope()).isEqualTo(ConsolidationScope.PARENT);
            assertThat(current.period()).isEqualTo(PeriodDescriptor.flow(LocalDate.of(2023, 1, 1), LocalDate.of(2023, 12, 31)));
            assertThat(prior.period().periodEnd()).isEqualTo(LocalDate.of(2022, 12, 31));
            assertThat(current.quality()).isCloseTo(0.9, within(1e-9));
            assertThat(current.period().factType()).isEqualTo(FactType.FLOW);
        }

        @Test
        void percentCellsUsePercentUnit() {
            TableCandidates result = builder.build(dictionary, table("利润表", "", labels, rows), new BuildContext("R1", VERSION_ID, 2023));

            FactCandidate margin = find(result, "gross_margin", "col_1");
            assertThat(margin.unit()).isEqualTo("percent");
            assertThat(margin.value()).isEqualByComparingTo(new BigDecimal("35.2"));
        }

        @Test
        void withoutFiscalYearPeriodsStayUnresolved() {
            TableCandidates result = builder.build(dictionary, table("利润表", "", labels, rows), new BuildContext("R1", VERSION_ID, null));

            FactCandidate current = find(result, "revenue", "col_1");
            assertThat(current.period().isResolved()).isFalse();
            assertThat(current.quality()).isCloseTo(0.8, within(1e-9));
        }
    }

    @Test
    void stackedYearHeaderKeepsCurrentAndPriorColumnsApart() {
        RawTableCandidate income = table(
            "合并利润表",
            "单位：元",
            List.of("项目", "2024年度/本期", "2024年度/上期"),
            List.of(
                List.of("营业总收入", "500", "400"),
                List.of("净利润", "50", "40")
            )
        );

        TableCandidates result = builder.build(dictionary, income, new BuildContext("R1", VERSION_ID, null));

        FactCandidate current = find(result, "revenue", "2024年度/本期");
        FactCandidate prior = find(result, "revenue", "2024年度/上期");
        assertThat(current.period()).isEqualTo(PeriodDescriptor.flow(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31)));
        assertThat(prior.period()).isEqualTo(PeriodDescriptor.flow(LocalDate.of(2023, 1, 1), LocalDate.of(2023, 12, 31)));
        assertThat(prior.value()).isEqualByComparingTo(new BigDecimal("400"));
    }

    @Test
    void tableBelowDistinctMetricMinimumWritesNothing() {
        RawTableCandidate narrative = table(
            "主要会计数据",
            "",
            List.of("项目", "2023年", "2022年"),
            List.of(
                List.of("营业收入", "500", "400"),
                List.of("研发投入占比", "5", "4")
            )
        );

        TableCandidates result = builder.build(dictionary, narrative, new BuildContext("R1", VERSION_ID, null));

        assertThat(result.accepted()).isFalse();
        assertThat(result.candidates()).isEmpty();
        assertThat(result.distinctMetrics()).isEqualTo(1);
    }

    @Test
    void singleColumnTableIsRejected() {
        RawTableCandidate stub = new RawTableCandidate("docling", 1, "", "",
            new LogicalGrid(List.of("col_0"), List.of(List.of("货币资金")), 0));

        assertThat(builder.build(dictionary, stub, new BuildContext("R1", VERSION_ID, 2023)).accepted()).isFalse();
    }
}
