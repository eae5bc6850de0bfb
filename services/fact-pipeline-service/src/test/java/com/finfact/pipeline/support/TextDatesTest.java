package com.finfact.pipeline.support;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class TextDatesTest {

    @Test
    void readsChineseAndIsoDates() {
        assertThat(TextDates.firstDate("2023年12月31日")).contains(LocalDate.of(2023, 12, 31));
        assertThat(TextDates.firstDate("as of 2022-06-30")).contains(LocalDate.of(2022, 6, 30));
    }

    @Test
    void skipsImpossibleDates() {
        assertThat(TextDates.firstDate("2023年2月30日")).isEmpty();
        assertThat(TextDates.firstDate("2023年13月01日")).isEmpty();
        assertThat(TextDates.firstDate(null)).isEmpty();
    }

    @Test
    void readsStandaloneYear() {
        assertThat(TextDates.firstYear("2023年度")).contains(2023);
        assertThat(TextDates.firstYear("编号120235")).isEmpty();
    }

    @Test
    void unitScaleFallsBackToOne() {
        assertThat(UnitScale.fromCode("10K")).isEqualTo(UnitScale.TEN_THOUSAND);
        assertThat(UnitScale.fromCode("bogus")).isEqualTo(UnitScale.ONE);
        assertThat(UnitScale.HUNDRED_MILLION.toBase(new BigDecimal("1.5")))
            .isEqualByComparingTo(new BigDecimal("150000000"));
    }
}
