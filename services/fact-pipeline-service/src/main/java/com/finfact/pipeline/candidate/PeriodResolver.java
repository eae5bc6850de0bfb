package com.finfact.pipeline.candidate;

import com.finfact.pipeline.config.PipelineProperties;
import com.finfact.pipeline.domain.FactType;
import com.finfact.pipeline.grid.LogicalGrid;
import com.finfact.pipeline.support.TextDates;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Derives the period of a value from its merged column label, anchored on the report's fiscal
 * year end. Tried in order: an explicit date, prior/current keywords (anchored on a year in the
 * label, else the fiscal year), a bare year, and finally the positional fallback where the first
 * value column is the current period and the second the prior one.
 */
@Component
public class PeriodResolver {

    private static final List<String> PRIOR_KEYWORDS = List.of(
        "上期", "上年", "期初", "年初", "上年度", "上年同期", "prior", "previous", "last year"
    );
    private static final List<String> CURRENT_KEYWORDS = List.of(
        "本期", "本年", "期末", "年末", "本年度", "本报告期", "current", "this year"
    );

    private final int fiscalYearEndMonth;
    private final int fiscalYearEndDay;

    public PeriodResolver(PipelineProperties properties) {
        this.fiscalYearEndMonth = properties.getCandidates().getFiscalYearEndMonth();
        this.fiscalYearEndDay = properties.getCandidates().getFiscalYearEndDay();
    }

    public Resolution resolve(String columnLabel, FactType factType, Integer fiscalYear) {
        String label = columnLabel == null ? "" : columnLabel;

        Optional<LocalDate> date = TextDates.firstDate(label);
        if (date.isPresent()) {
            return new Resolution(describe(factType, date.get()), false);
        }
        Optional<Integer> year = TextDates.firstYear(label);
        Integer anchor = year.orElse(fiscalYear);
        if (anchor != null) {
            String lowered = label.toLowerCase(Locale.ROOT);
            if (PRIOR_KEYWORDS.stream().anyMatch(lowered::contains)) {
                return new Resolution(describe(factType, yearEnd(anchor - 1)), false);
            }
            if (CURRENT_KEYWORDS.stream().anyMatch(lowered::contains)) {
                return new Resolution(describe(factType, yearEnd(anchor)), false);
            }
        }
        if (year.isPresent()) {
            return new Resolution(describe(factType, yearEnd(year.get())), false);
        }

        if (fiscalYear != null && LogicalGrid.isPositionalLabel(label)) {
            int position = Integer.parseInt(label.substring("col_".length()));
            if (position == 1) {
                return new Resolution(describe(factType, yearEnd(fiscalYear)), true);
            }
            if (position == 2) {
                return new Resolution(describe(factType, yearEnd(fiscalYear - 1)), true);
            }
        }
        return new Resolution(PeriodDescriptor.unresolved(factType), false);
    }

    public LocalDate yearEnd(int year) {
        YearMonth month = YearMonth.of(year, fiscalYearEndMonth);
        return month.atDay(Math.min(fiscalYearEndDay, month.lengthOfMonth()));
    }

    private static PeriodDescriptor describe(FactType factType, LocalDate end) {
        if (factType == FactType.STOCK) {
            return PeriodDescriptor.stock(end);
        }
        return PeriodDescriptor.flow(end.minusYears(1).plusDays(1), end);
    }

    /**
     * @param period     resolved period, possibly unresolved
     * @param positional true when only the column position decided the period
     */
    public record Resolution(PeriodDescriptor period, boolean positional) {
    }
}
