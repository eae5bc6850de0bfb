package com.finfact.pipeline.candidate;

import static org.assertj.core.api.Assertions.assertThat;

import com.finfact.pipeline.config.PipelineProperties;
import com.finfact.pipeline.domain.FactType;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PeriodResolver")
class PeriodResolverTest {

    private PeriodResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new PeriodResolver(new PipelineProperties());
    }

    @Nested
    @DisplayName("explicit periods")
    class Explicit {

        @Test
        void dateInLabelGivesStockAsOfDate() {
            PeriodResolver.Resolution resolution = resolver.resolve("合并/2023年12月31日", FactType.STOCK, null);

            assertThat(resolution.period()).isEqualTo(PeriodDescriptor.stock(LocalDate.of(2023, 12, 31)));
            assertThat(resolution.positional()).isFalse();
        }

        @Test
        void yearInLabelGivesFullFlowPeriod() {
            PeriodDescriptor period = resolver.resolve("2023年度", FactType.FLOW, null).period();

            assertThat(period.periodStart()).isEqualTo(LocalDate.of(2023, 1, 1));
            assertThat(period.periodEnd()).isEqualTo(LocalDate.of(2023, 12, 31));
            assertThat(period.asKey()).isEqualTo("2023-01-01..2023-12-31");
        }
    }

    @Nested
    @DisplayName("keywords and positions")
    class Relative {

        @Test
        void priorKeywordsStepBackOneYear() {
            assertThat(resolver.resolve("期初余额", FactType.STOCK, 2023).period().asOfDate())
                .isEqualTo(LocalDate.of(2022, 12, 31));
            assertThat(resolver.resolve("上期金额", FactType.FLOW, 2023).period().periodEnd())
                .isEqualTo(LocalDate.of(2022, 12, 31));
        }

        @Test
        void currentKeywordsUseFiscalYear() {
            assertThat(resolver.resolve("本期金额", FactType.FLOW, 2023).period().periodEnd())
                .isEqualTo(LocalDate.of(2023, 12, 31));
            assertThat(resolver.resolve("期末余额", FactType.STOCK, 2023).period().asOfDate())
                .isEqualTo(LocalDate.of(2023, 12, 31));
        }

        @Test
        void keywordUnderYearHeaderIsAnchoredOnThatYear() {
            PeriodDescriptor prior = resolver.resolve("2024年度/上期", FactType.FLOW, null).period();
            PeriodDescriptor current = resolver.resolve("2024年度/本期", FactType.FLOW, 2030).period();

            assertThat(prior).isEqualTo(PeriodDescriptor.flow(LocalDate.of(2023, 1, 1), LocalDate.of(2023, 12, 31)));
            assertThat(current).isEqualTo(PeriodDescriptor.flow(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31)));
            assertThat(resolver.resolve("2024年/年初余额", FactType.STOCK, 2024).period().asOfDate())
                .isEqualTo(LocalDate.of(2023, 12, 31));
        }

        @Test
        void positionalColumnsAreFlagged() {
            PeriodResolver.Resolution first = resolver.resolve("col_1", FactType.STOCK, 2023);
            PeriodResolver.Resolution second = resolver.resolve("col_2", FactType.STOCK, 2023);

            assertThat(first.positional()).isTrue();
            assertThat(first.period().asOfDate()).isEqualTo(LocalDate.of(2023, 12, 31));
            assertThat(second.period().asOfDate()).isEqualTo(LocalDate.of(2022, 12, 31));
            assertThat(resolver.resolve("col_3", FactType.STOCK, 2023).period().isResolved()).isFalse();
        }

        @Test
        void relativeLabelsNeedAFiscalYear() {
            PeriodDescriptor period = resolver.resolve("期末余额", FactType.STOCK, null).period();

            assertThat(period.isResolved()).isFalse();
            assertThat(period.asKey()).isEqualTo("unknown");
        }
    }

    @Test
    void fiscalYearEndIsConfigurable() {
        PipelineProperties properties = new PipelineProperties();
        properties.getCandidates().setFiscalYearEndMonth(6);
        properties.getCandidates().setFiscalYearEndDay(31);
        PeriodResolver juneResolver = new PeriodResolver(properties);

        assertThat(juneResolver.yearEnd(2023)).isEqualTo(LocalDate.of(2023, 6, 30));
        assertThat(juneResolver.resolve("本年", FactType.FLOW, 2023).period().periodStart())
            .isEqualTo(LocalDate.of(2022, 7, 1));
    }
}
